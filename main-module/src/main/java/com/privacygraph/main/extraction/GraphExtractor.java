package com.privacygraph.main.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.privacygraph.common.ingest.ExtractedGraph;
import com.privacygraph.main.exception.GraphExtractionException;
import dev.langchain4j.model.chat.ChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Asks the chat model for the entities and relationships of a document and parses its JSON answer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphExtractor {

    static final String PROMPT_HEADER =
            "You are an expert at building knowledge graphs for data governance and privacy regulations. "
            + "Your task is to extract information from the provided document according to a specific schema.\n\n"
            + "**Schema & Topology Rules:**\n"
            + "1.  Identify and classify entities into one of five types:\n"
            + "    - **Asset**: A system, application, or database (e.g., 'CRM Platform', 'Production Aurora DB').\n"
            + "    - **ProcessingActivity**: A business process that uses data "
            + "(e.g., 'User Authentication', 'Monthly Newsletter Campaign').\n"
            + "    - **DataElement**: A specific category of personal data "
            + "(e.g., 'Contact Info', 'Financial Info', 'IP Address').\n"
            + "    - **DataSubjectType**: A category of individual (e.g., 'Customer', 'Employee', 'Patient').\n"
            + "    - **Vendor**: A third-party company or service.\n"
            + "2.  Identify the relationships between these entities. Common relationships include:\n"
            + "    - A 'ProcessingActivity' **PROCESSES_DATA_FROM** an 'Asset'.\n"
            + "    - An 'Asset' **CONTAINS** 'DataElements'.\n"
            + "    - A 'DataElement' **BELONGS_TO** a 'DataSubjectType'.\n"
            + "    - An 'Asset' **TRANSFERS_TO** a 'Vendor'.\n\n"
            + "**Output Format:**\n"
            + "- Return a single, valid JSON object with 'nodes' and 'relationships' keys. Do not include any other text.\n"
            + "- 'nodes' is a list of objects, each with 'id' (a unique name) and 'type', "
            + "optionally 'description' and 'properties'.\n"
            + "- 'relationships' is a list of objects, each with 'source' (name), 'target' (name), "
            + "and 'relationship_type', optionally 'properties'.\n\n"
            + "**Document:**\n"
            + "---\n";

    static final String PROMPT_FOOTER = "\n---\n";

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;

    /**
     * @throws GraphExtractionException when the model fails, answers with something other than a graph,
     *                                  or finds no nodes
     */
    public ExtractedGraph extract(String documentText) {
        if (documentText == null || documentText.isBlank()) {
            throw new IllegalArgumentException("Document text cannot be blank");
        }

        String answer;
        try {
            answer = chatModel.chat(prompt(documentText));
        } catch (RuntimeException e) {
            throw new GraphExtractionException("Extraction model call failed: " + e.getMessage(), e);
        }
        if (answer == null || answer.isBlank()) {
            throw new GraphExtractionException("Extraction model returned an empty answer");
        }

        ExtractedGraph graph = parse(answer);
        if (graph.nodes().isEmpty()) {
            throw new GraphExtractionException("Failed to extract a valid graph from the document");
        }
        log.info("Extracted {} nodes and {} relationships from document of {} characters",
                graph.nodes().size(), graph.relationships().size(), documentText.length());
        return graph;
    }

    static String prompt(String documentText) {
        return PROMPT_HEADER + documentText + PROMPT_FOOTER;
    }

    ExtractedGraph parse(String answer) {
        String json = stripCodeFences(answer);
        try {
            ExtractedGraph graph = objectMapper.readValue(json, ExtractedGraph.class);
            if (graph == null) {
                throw new GraphExtractionException("Extraction model returned no graph");
            }
            return graph;
        } catch (JsonProcessingException e) {
            log.warn("Unparsable extraction answer: {}", abbreviate(answer));
            throw new GraphExtractionException("Extraction model returned invalid JSON", e);
        }
    }

    static String stripCodeFences(String answer) {
        return answer.strip()
                .replace("```json", "")
                .replace("```", "")
                .strip();
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
