package tech.yump.rotator.template;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;
import tech.yump.rotator.config.RotatorProperties;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Catalog of provider templates, loaded once from {@code rotator.templates.locations}.
 * Any unreadable or inconsistent document fails startup with {@link TemplateDefinitionException}.
 */
@Slf4j
@Component
public class TemplateRegistry {

    private final RotatorProperties properties;
    private final ObjectMapper objectMapper;
    private final TemplateValidator templateValidator;
    private final ResourcePatternResolver resourceResolver;

    private volatile Map<String, ProviderTemplate> templates = Map.of();

    @Autowired
    public TemplateRegistry(RotatorProperties properties, ObjectMapper objectMapper, TemplateValidator templateValidator) {
        this(properties, objectMapper, templateValidator, new PathMatchingResourcePatternResolver());
    }

    TemplateRegistry(RotatorProperties properties, ObjectMapper objectMapper, TemplateValidator templateValidator,
                     ResourcePatternResolver resourceResolver) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.templateValidator = templateValidator;
        this.resourceResolver = resourceResolver;
    }

    @PostConstruct
    public void load() {
        Map<String, ProviderTemplate> loaded = new TreeMap<>();
        for (String location : properties.templates().locations()) {
            Resource[] resources;
            try {
                resources = resourceResolver.getResources(location);
            } catch (IOException e) {
                throw new TemplateDefinitionException("Cannot list provider templates at '" + location + "'", e);
            }
            log.debug("Found {} template document(s) at '{}'", resources.length, location);
            for (Resource resource : resources) {
                ProviderTemplate template = read(resource);
                ProviderTemplate previous = loaded.putIfAbsent(template.name(), template);
                if (previous != null) {
                    throw new TemplateDefinitionException(resource.getDescription(),
                            List.of("duplicate template name '" + template.name() + "'"));
                }
            }
        }
        if (loaded.isEmpty()) {
            log.warn("No provider templates found at {}", properties.templates().locations());
        }
        this.templates = Collections.unmodifiableMap(loaded);
        log.info("Loaded {} provider template(s): {}", loaded.size(), loaded.keySet());
    }

    /**
     * @throws TemplateNotFoundException if no template has this name.
     */
    public ProviderTemplate get(String name) {
        ProviderTemplate template = templates.get(name);
        if (template == null) {
            throw new TemplateNotFoundException(name);
        }
        return template;
    }

    public Collection<ProviderTemplate> all() {
        return templates.values();
    }

    private ProviderTemplate read(Resource resource) {
        ProviderTemplate template;
        try (InputStream in = resource.getInputStream()) {
            template = objectMapper.readValue(in, ProviderTemplate.class);
        } catch (IOException e) {
            throw new TemplateDefinitionException("Cannot parse provider template " + resource.getDescription() + ": " + e.getMessage(), e);
        }
        List<String> problems = templateValidator.validate(template);
        if (!problems.isEmpty()) {
            throw new TemplateDefinitionException(resource.getDescription(), problems);
        }
        log.debug("Registered template '{}' with operations {}", template.name(), template.functions().keySet());
        return template;
    }
}
