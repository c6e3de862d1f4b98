package com.github.salilvnair.commandconsole.llm.core;

/**
 * Intent inference service. Applications register one bean; without it the console runs on
 * keyword matching alone.
 */
public interface LlmClient {

    /**
     * @param hint        rendered prompt
     * @param jsonSchema  JSON schema of the expected answer
     * @param contextJson request context (message, role, registry summary)
     * @return raw model output, expected to contain one JSON object
     */
    String generateJson(String hint, String jsonSchema, String contextJson);
}
