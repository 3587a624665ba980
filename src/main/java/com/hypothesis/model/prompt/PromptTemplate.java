package com.hypothesis.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Prompt template loaded from YAML.
 *
 * <pre>
 * name: research-planner
 * version: 1.0
 * systemPrompt: |
 *   You plan biomedical research...
 * userPrompt: |
 *   Question: {{{question}}}
 * </pre>
 *
 * @see com.hypothesis.service.PromptLibraryService
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private String systemPrompt;
    private String userPrompt;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public String getUserPrompt() {
        return userPrompt;
    }

    public void setUserPrompt(String userPrompt) {
        this.userPrompt = userPrompt;
    }
}
