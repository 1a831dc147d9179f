package org.fol.serialize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.fol.ast.FormulaNode;
import org.fol.ast.NodeKind;
import org.fol.ast.Term;
import org.fol.metrics.FormulaMetrics;
import org.fol.metrics.VariableBinding;
import org.fol.support.AnalysisConfiguration;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.logging.Logger;

/**
 * ESPORTAZIONE JSON - AST e metriche nel formato letto dai collaboratori esterni
 *
 * FORMATO AST: record annidati {@code {kind, value?, children}}; i termini
 * argomento dei predicati compaiono come figli {@code {kind: "TERM", value}}.
 *
 * FORMATO METRICHE: campi con gli stessi nomi di {@link FormulaMetrics}; le
 * mappe di scope hanno come chiave l'id pre-order del nodo.
 *
 * DOCUMENTO DI ANALISI: {@code {originalFormula, ast, metrics}}.
 *
 * L'altezza dell'AST viene verificata contro il limite configurato prima
 * della conversione ricorsiva.
 */
public final class AnalysisJsonExporter {

    private static final Logger LOGGER = Logger.getLogger(AnalysisJsonExporter.class.getName());

    /** Tipo usato per i termini argomento nel record annidato */
    public static final String TERM_KIND = "TERM";

    private final ObjectMapper mapper;
    private final AnalysisConfiguration configuration;

    public AnalysisJsonExporter() {
        this(AnalysisConfiguration.defaults());
    }

    public AnalysisJsonExporter(AnalysisConfiguration configuration) {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT), configuration);
    }

    public AnalysisJsonExporter(ObjectMapper mapper, AnalysisConfiguration configuration) {
        if (mapper == null || configuration == null) {
            throw new IllegalArgumentException("ObjectMapper e configurazione sono obbligatori");
        }
        this.mapper = mapper;
        this.configuration = configuration;
    }

    //region AST

    /**
     * @throws org.fol.support.DepthLimitExceededException se l'AST supera l'altezza massima
     */
    public ObjectNode toJson(FormulaNode node) {
        if (node == null) {
            throw new IllegalArgumentException("Nodo da esportare non può essere null");
        }
        configuration.checkDepth(node.height());
        return nodeToJson(node);
    }

    private ObjectNode nodeToJson(FormulaNode node) {
        ObjectNode json = mapper.createObjectNode();
        json.put("kind", node.kind().name());
        if (node.hasValue()) {
            json.put("value", node.value());
        }

        ArrayNode children = json.putArray("children");
        if (node.isAtomic()) {
            for (Term argument : node.arguments()) {
                children.add(termToJson(argument));
            }
        } else {
            for (FormulaNode child : node.children()) {
                children.add(nodeToJson(child));
            }
        }
        return json;
    }

    private ObjectNode termToJson(Term term) {
        ObjectNode json = mapper.createObjectNode();
        json.put("kind", TERM_KIND);
        json.put("value", term.name());
        json.putArray("children");
        return json;
    }

    //endregion

    //region METRICHE

    public ObjectNode toJson(FormulaMetrics metrics) {
        ObjectNode json = mapper.createObjectNode();
        json.put("totalDepth", metrics.totalDepth());
        json.put("operatorDepth", metrics.operatorDepth());
        json.set("quantifierScope", idMapToJson(metrics.quantifierScope()));
        json.set("connectiveScope", idMapToJson(metrics.connectiveScope()));
        json.set("variableBinding", bindingToJson(metrics.variableBinding()));
        json.put("subformulaCount", metrics.subformulaCount());
        json.put("quantifierCount", metrics.quantifierCount());

        ObjectNode distribution = json.putObject("connectiveDistribution");
        for (Map.Entry<NodeKind, Integer> entry : metrics.connectiveDistribution().entrySet()) {
            distribution.put(entry.getKey().name(), entry.getValue());
        }

        json.put("atomCount", metrics.atomCount());
        return json;
    }

    private ObjectNode bindingToJson(VariableBinding binding) {
        ObjectNode json = mapper.createObjectNode();
        json.put("bound", binding.boundOccurrences());
        json.put("free", binding.freeOccurrences());
        json.set("byQuantifier", idMapToJson(binding.occurrencesByQuantifier()));
        ArrayNode free = json.putArray("freeVariables");
        binding.freeVariables().forEach(free::add);
        return json;
    }

    private ObjectNode idMapToJson(Map<Integer, Integer> idMap) {
        ObjectNode json = mapper.createObjectNode();
        for (Map.Entry<Integer, Integer> entry : idMap.entrySet()) {
            json.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return json;
    }

    //endregion

    //region DOCUMENTO DI ANALISI

    /**
     * Documento completo {@code {originalFormula, ast, metrics}}.
     */
    public ObjectNode toAnalysisDocument(String originalFormula, FormulaNode ast, FormulaMetrics metrics) {
        ObjectNode document = mapper.createObjectNode();
        document.put("originalFormula", originalFormula);
        document.set("ast", toJson(ast));
        document.set("metrics", toJson(metrics));
        return document;
    }

    public String writeAsString(ObjectNode document) {
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Serializzazione JSON fallita", e);
        }
    }

    /**
     * Scrive un documento JSON su file (UTF-8), creando le directory mancanti.
     *
     * @throws UncheckedIOException se la scrittura fallisce
     */
    public Path write(ObjectNode document, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(target.toFile(), document);
            LOGGER.info("Analisi salvata in: " + target);
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Scrittura di " + target + " fallita", e);
        }
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    //endregion
}
