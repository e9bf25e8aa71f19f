package com.eli5y.infrastructure.ai;

import com.eli5y.domain.formula.model.AlignmentDiagnostic;
import com.eli5y.domain.formula.model.DiagnosticType;
import com.eli5y.domain.formula.model.FormulaDraft;
import com.eli5y.domain.formula.model.RawComponent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the model's JSON draft into a {@link FormulaDraft}.
 * <p>
 * {@code symbol} is accepted both as a list and as a bare string (older drafts); it always
 * leaves here as a list. A component of the wrong shape is kept with whatever could be read
 * and reported, so the aligner drops it instead of the whole draft failing.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DraftParser {

    private final ObjectMapper objectMapper;

    /**
     * Parse raw model output.
     *
     * @throws AiDraftException if the text is not a JSON object with a text {@code explanation}
     */
    public FormulaDraft parse(String content) {
        if (content == null || content.isBlank()) {
            throw new AiDraftException("Draft is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new AiDraftException("Draft is not valid JSON", e);
        }
        return fromNode(root);
    }

    /**
     * Read an already-parsed draft object.
     *
     * @throws AiDraftException if {@code root} is not an object with a text {@code explanation}
     */
    public FormulaDraft fromNode(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new AiDraftException("Draft must be a JSON object");
        }
        JsonNode explanation = root.get("explanation");
        if (explanation == null || !explanation.isTextual()) {
            throw new AiDraftException("Draft has no explanation text");
        }

        List<RawComponent> components = new ArrayList<>();
        List<AlignmentDiagnostic> issues = new ArrayList<>();

        JsonNode componentsNode = root.get("components");
        if (componentsNode != null && componentsNode.isArray()) {
            for (JsonNode node : componentsNode) {
                components.add(readComponent(node, issues));
            }
        } else if (componentsNode != null && !componentsNode.isNull()) {
            issues.add(AlignmentDiagnostic.ofComponent(DiagnosticType.MALFORMED_COMPONENT, "",
                    "components is not a list"));
        }

        if (!issues.isEmpty()) {
            log.info("[DraftParser] {} malformed component(s) in draft", issues.size());
        }
        return new FormulaDraft(explanation.asText(), components, issues);
    }

    private RawComponent readComponent(JsonNode node, List<AlignmentDiagnostic> issues) {
        if (node == null || !node.isObject()) {
            issues.add(AlignmentDiagnostic.ofComponent(DiagnosticType.MALFORMED_COMPONENT, "",
                    "Component is not an object: " + node));
            return new RawComponent(List.of(), "");
        }

        String counterpart = "";
        JsonNode counterpartNode = node.get("counterpart");
        if (counterpartNode != null && counterpartNode.isTextual()) {
            counterpart = counterpartNode.asText().strip();
        } else {
            issues.add(AlignmentDiagnostic.ofComponent(DiagnosticType.MALFORMED_COMPONENT, "",
                    "counterpart is missing or not text"));
        }

        List<String> symbols = readSymbols(node.get("symbol"), counterpart, issues);

        JsonNode roleNode = node.get("role");
        String role = roleNode != null && roleNode.isTextual() && !roleNode.asText().isBlank()
                ? roleNode.asText().strip()
                : null;

        return new RawComponent(symbols, counterpart, role);
    }

    private List<String> readSymbols(JsonNode symbolNode, String counterpart, List<AlignmentDiagnostic> issues) {
        if (symbolNode != null && symbolNode.isTextual()) {
            return List.of(symbolNode.asText());
        }
        if (symbolNode != null && symbolNode.isArray()) {
            List<String> symbols = new ArrayList<>();
            for (JsonNode item : symbolNode) {
                if (item.isTextual()) {
                    symbols.add(item.asText());
                } else {
                    issues.add(AlignmentDiagnostic.ofSymbol(DiagnosticType.MALFORMED_COMPONENT, counterpart,
                            String.valueOf(item), "Non-text symbol ignored"));
                }
            }
            return symbols;
        }

        issues.add(AlignmentDiagnostic.ofComponent(DiagnosticType.MALFORMED_COMPONENT, counterpart,
                "symbol is missing or neither text nor a list"));
        return List.of();
    }
}
