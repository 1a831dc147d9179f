package org.fol.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.fol.antlr.FolFormulaBaseVisitor;
import org.fol.antlr.FolFormulaParser;
import org.fol.antlr.FolFormulaParser.AndContext;
import org.fol.antlr.FolFormulaParser.EqualityContext;
import org.fol.antlr.FolFormulaParser.FormulaContext;
import org.fol.antlr.FolFormulaParser.IffContext;
import org.fol.antlr.FolFormulaParser.ImpliesContext;
import org.fol.antlr.FolFormulaParser.NotContext;
import org.fol.antlr.FolFormulaParser.OrContext;
import org.fol.antlr.FolFormulaParser.ParContext;
import org.fol.antlr.FolFormulaParser.PredicateContext;
import org.fol.antlr.FolFormulaParser.PrimaryContext;
import org.fol.antlr.FolFormulaParser.PropositionContext;
import org.fol.antlr.FolFormulaParser.QuantifiedContext;
import org.fol.antlr.FolFormulaParser.TermContext;
import org.fol.antlr.FolFormulaParser.XorContext;
import org.fol.ast.FormulaNode;
import org.fol.ast.NodeKind;
import org.fol.ast.Term;
import org.fol.support.AnalysisConfiguration;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * NORMALIZZATORE AST - Da albero sintattico ANTLR ad AST canonico immutabile
 *
 * Visita il parse tree prodotto dalla grammatica FolFormula e costruisce i
 * nodi canonici dal basso verso l'alto: ogni figlio è già normalizzato quando
 * il padre viene costruito, quindi nessuno stato parziale esce dal visitor.
 *
 * REGOLE DI NORMALIZZAZIONE:
 * - Catena n-aria di lunghezza >= 2 allo stesso livello: ripiegata a sinistra
 *   in nodi binari annidati dello stesso tipo (A ∧ B ∧ C ~ (A ∧ B) ∧ C)
 * - Catena di lunghezza 1: collassata nel suo unico operando
 * - NOT, FORALL, EXISTS: sempre materializzati come nodo proprio, anche quando
 *   sono l'unico elemento del costrutto che li contiene
 * - Parentesi: trasparenti, scompaiono dall'AST
 *
 * Ogni nodo costruito viene verificato contro l'altezza massima configurata.
 */
public final class AstNormalizer extends FolFormulaBaseVisitor<FormulaNode> {

    private static final Logger LOGGER = Logger.getLogger(AstNormalizer.class.getName());

    private final AnalysisConfiguration configuration;

    public AstNormalizer(AnalysisConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("Configurazione non può essere null");
        }
        this.configuration = configuration;
    }

    /**
     * Normalizza un albero sintattico completo o un suo sottoalbero.
     *
     * @param tree parse tree generato da {@link FolFormulaParser}
     * @return AST canonico
     * @throws org.fol.support.DepthLimitExceededException se l'AST supera l'altezza massima
     */
    public FormulaNode normalize(ParseTree tree) {
        if (tree == null) {
            throw new IllegalArgumentException("Albero sintattico non può essere null");
        }
        return visit(tree);
    }

    //region PUNTO DI INGRESSO

    @Override
    public FormulaNode visitFormula(FormulaContext ctx) {
        return visit(ctx.biconditional());
    }

    //endregion

    //region CATENE BINARIE (UN LIVELLO PER PRECEDENZA)

    @Override
    public FormulaNode visitIff(IffContext ctx) {
        return foldChain(NodeKind.BICOND, ctx.implication());
    }

    @Override
    public FormulaNode visitImplies(ImpliesContext ctx) {
        return foldChain(NodeKind.IMPLIES, ctx.exclusiveOr());
    }

    @Override
    public FormulaNode visitXor(XorContext ctx) {
        return foldChain(NodeKind.XOR, ctx.disjunction());
    }

    @Override
    public FormulaNode visitOr(OrContext ctx) {
        return foldChain(NodeKind.OR, ctx.conjunction());
    }

    @Override
    public FormulaNode visitAnd(AndContext ctx) {
        return foldChain(NodeKind.AND, ctx.unary());
    }

    /**
     * Ripiega a sinistra una catena di operandi dello stesso livello.
     * Un solo operando viene restituito così com'è, senza nodo contenitore.
     */
    private FormulaNode foldChain(NodeKind kind, List<? extends ParserRuleContext> operands) {
        FormulaNode result = visit(operands.get(0));
        if (operands.size() > 1) {
            LOGGER.finest("Ripiegamento catena " + kind + " di " + operands.size() + " operandi");
        }
        for (int i = 1; i < operands.size(); i++) {
            FormulaNode right = visit(operands.get(i));
            result = checked(FormulaNode.binary(kind, result, right));
        }
        return result;
    }

    //endregion

    //region COSTRUTTI UNARI (MAI COLLASSATI)

    @Override
    public FormulaNode visitNot(NotContext ctx) {
        FormulaNode operand = visit(ctx.unary());
        return checked(FormulaNode.not(operand));
    }

    @Override
    public FormulaNode visitQuantified(QuantifiedContext ctx) {
        NodeKind kind = ctx.quantifier.getType() == FolFormulaParser.FORALL ? NodeKind.FORALL : NodeKind.EXISTS;
        String variable = ctx.IDENTIFIER().getText();
        FormulaNode scope = visit(ctx.unary());
        return checked(FormulaNode.quantified(kind, variable, scope));
    }

    @Override
    public FormulaNode visitPrimary(PrimaryContext ctx) {
        return visit(ctx.atom());
    }

    //endregion

    //region FORMULE ATOMICHE E PARENTESI

    @Override
    public FormulaNode visitPredicate(PredicateContext ctx) {
        List<Term> arguments = new ArrayList<>();
        for (TermContext termCtx : ctx.term()) {
            arguments.add(toTerm(termCtx));
        }
        return FormulaNode.predicate(ctx.IDENTIFIER().getText(), arguments);
    }

    @Override
    public FormulaNode visitProposition(PropositionContext ctx) {
        return FormulaNode.predicate(ctx.IDENTIFIER().getText(), List.of());
    }

    @Override
    public FormulaNode visitEquality(EqualityContext ctx) {
        return FormulaNode.equality(toTerm(ctx.term(0)), toTerm(ctx.term(1)));
    }

    @Override
    public FormulaNode visitPar(ParContext ctx) {
        return visit(ctx.biconditional());
    }

    private static Term toTerm(TermContext ctx) {
        return new Term(ctx.IDENTIFIER().getText());
    }

    //endregion

    private FormulaNode checked(FormulaNode node) {
        configuration.checkDepth(node.height());
        return node;
    }
}
