package org.fol.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.fol.antlr.FolFormulaLexer;
import org.fol.antlr.FolFormulaParser;
import org.fol.ast.FormulaNode;
import org.fol.support.AnalysisConfiguration;
import org.fol.support.FormulaSyntaxException;

import java.util.logging.Logger;

/**
 * PARSER FOL - Da testo in notazione Unicode ad AST canonico
 *
 * PIPELINE:
 * 1. Lexing ANTLR (errori lessicali -> {@link FormulaSyntaxException})
 * 2. Misura dell'annidamento sui token, prima della discesa ricorsiva
 * 3. Parsing ANTLR con listener che interrompe al primo errore
 * 4. Normalizzazione del parse tree con {@link AstNormalizer}
 *
 * OPERATORI (in ordine di precedenza crescente):
 * ↔, →, ⊕, ∨, ∧, ¬, ∀/∃, predicato e uguaglianza.
 *
 * Il parser non ha stato mutabile: un'istanza può essere condivisa fra thread
 * e ogni chiamata crea lexer e parser ANTLR propri.
 */
public final class FolParser {

    private static final Logger LOGGER = Logger.getLogger(FolParser.class.getName());

    private final AnalysisConfiguration configuration;

    public FolParser() {
        this(AnalysisConfiguration.defaults());
    }

    public FolParser(AnalysisConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("Configurazione non può essere null");
        }
        this.configuration = configuration;
    }

    /**
     * Analizza una formula e ne restituisce l'AST canonico.
     *
     * @param formula testo della formula
     * @return AST canonico immutabile
     * @throws FormulaSyntaxException se la formula è vuota o malformata
     * @throws org.fol.support.DepthLimitExceededException se l'annidamento supera il limite
     */
    public FormulaNode parse(String formula) {
        FolFormulaParser.FormulaContext tree = parseTree(formula);
        FormulaNode ast = new AstNormalizer(configuration).normalize(tree);
        LOGGER.fine("Formula analizzata: " + ast);
        return ast;
    }

    /**
     * Produce l'albero sintattico grezzo, prima della normalizzazione.
     *
     * @throws FormulaSyntaxException se la formula è vuota o malformata
     * @throws org.fol.support.DepthLimitExceededException se l'annidamento supera il limite
     */
    public FolFormulaParser.FormulaContext parseTree(String formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }
        if (formula.isBlank()) {
            throw new FormulaSyntaxException("formula vuota", formula, 0, 1, 0, "");
        }

        SyntaxErrorListener errorListener = new SyntaxErrorListener(formula);

        FolFormulaLexer lexer = new FolFormulaLexer(CharStreams.fromString(formula));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();
        configuration.checkDepth(NestingDepthScanner.measure(tokens.getTokens()));

        FolFormulaParser parser = new FolFormulaParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        return parser.formula();
    }

    public AnalysisConfiguration getConfiguration() {
        return configuration;
    }
}
