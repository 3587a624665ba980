package com.hypothesis.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.hypothesis.model.prompt.PromptTemplate;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads prompts from {@code classpath:prompts/*.yaml} and renders them with Mustache.
 *
 * <p>Templates use triple braces for values so JSON and Cypher reach the model unescaped.
 */
@Slf4j
@Service
public class PromptLibraryService {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:prompts/*.yaml");

            for (Resource resource : resources) {
                PromptTemplate template = yamlMapper.readValue(resource.getInputStream(), PromptTemplate.class);
                templates.put(template.getName(), template);
                log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
            }
            log.info("Loaded {} prompt templates", templates.size());

        } catch (Exception e) {
            log.error("Failed to load prompt templates", e);
            throw new IllegalStateException("Prompt library initialization failed", e);
        }
    }

    public String render(String templateName, Map<String, Object> variables) {
        Mustache mustache = compiled.computeIfAbsent(templateName, name -> {
            PromptTemplate template = templates.get(name);
            if (template == null) {
                throw new IllegalArgumentException("Prompt template not found: " + name);
            }
            String fullPrompt = template.getSystemPrompt() + "\n\n" + template.getUserPrompt();
            return mustacheFactory.compile(new StringReader(fullPrompt), name);
        });

        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString();
    }

    public PromptTemplate getTemplate(String name) {
        return templates.get(name);
    }
}
