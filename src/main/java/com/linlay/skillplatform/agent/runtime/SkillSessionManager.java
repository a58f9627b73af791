package com.linlay.skillplatform.agent.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.skillplatform.agent.PlannedToolCall;
import com.linlay.skillplatform.backend.FilePaths;
import com.linlay.skillplatform.skill.SkillDependencyResolver;
import com.linlay.skillplatform.skill.SkillManifest;
import com.linlay.skillplatform.skill.SkillMetadataCache.SkillPromptMetadata;
import com.linlay.skillplatform.skill.SkillSessionSnapshot;
import com.linlay.skillplatform.skill.SkillSlugs;
import com.linlay.skillplatform.tool.BaseTool;
import com.linlay.skillplatform.tool.IntegrationName;
import com.linlay.skillplatform.tool.IntegrationToolCatalog;
import com.linlay.skillplatform.tool.ToolName;
import com.linlay.skillplatform.tool.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Skill hooks of the turn framework: turn start, every model call and every tool call.
 * <p>
 * Per turn a skill moves from not visible to visible (resolver) to activated (its SKILL.md was read).
 * Reading the SKILL.md of a skill that is not visible is denied without touching the file.
 */
@Service
public class SkillSessionManager {

    private static final Logger log = LoggerFactory.getLogger(SkillSessionManager.class);
    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {
    };

    public static final String READ_FILE_TOOL = "read_file";
    public static final String SKILL_NOT_VISIBLE = "skill_not_visible";

    private static final Pattern MANIFEST_PATH = Pattern.compile(
            "^/skills/([a-z0-9]+(?:-[a-z0-9]+)*)/" + Pattern.quote(SkillManifest.FILE_NAME) + "$");

    private final SkillDependencyResolver resolver;
    private final ToolRegistry toolRegistry;
    private final IntegrationToolCatalog integrationToolCatalog;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final SkillPromptSection promptSection;

    @Autowired
    public SkillSessionManager(
            SkillDependencyResolver resolver,
            ToolRegistry toolRegistry,
            IntegrationToolCatalog integrationToolCatalog,
            ObjectMapper objectMapper
    ) {
        this(resolver, toolRegistry, integrationToolCatalog, objectMapper, Clock.systemUTC(), SkillPromptSection.DEFAULTS);
    }

    public SkillSessionManager(
            SkillDependencyResolver resolver,
            ToolRegistry toolRegistry,
            IntegrationToolCatalog integrationToolCatalog,
            ObjectMapper objectMapper,
            Clock clock,
            SkillPromptSection promptSection
    ) {
        this.resolver = resolver;
        this.toolRegistry = toolRegistry;
        this.integrationToolCatalog = integrationToolCatalog;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.promptSection = promptSection == null ? SkillPromptSection.DEFAULTS : promptSection;
    }

    // ========= Turn start =========

    public void beforeTurn(TurnContext context) {
        if (context.snapshot() != null || context.skillsPromptInjected()) {
            log.debug("[run:{}] skills already prepared for this turn", context.runId());
            return;
        }
        List<String> selected = SkillSlugs.normalizeSelected(context.selectedSkills());
        if (selected.isEmpty()) {
            context.snapshot(SkillSessionSnapshot.EMPTY);
            return;
        }

        SkillSessionSnapshot snapshot;
        try {
            snapshot = resolver.resolve(selected);
        } catch (RuntimeException ex) {
            log.warn("[run:{}] skill resolution failed, continuing with selected skills only", context.runId(), ex);
            context.snapshot(SkillSessionSnapshot.degraded(selected));
            return;
        }
        context.snapshot(snapshot);

        if (snapshot.visibleSkills().isEmpty()) {
            return;
        }
        if (!hasReadFile(context.baseTools())) {
            log.warn("[run:{}] read_file unavailable, skills prompt is not injected", context.runId());
            return;
        }
        try {
            List<SkillPromptMetadata> metadata = new ArrayList<>();
            for (String slug : snapshot.visibleSkills()) {
                SkillPromptMetadata item = snapshot.promptMetadata().get(slug);
                if (item != null) {
                    metadata.add(item);
                }
            }
            if (metadata.isEmpty()) {
                return;
            }
            context.appendSystemPrompt(promptSection.render(metadata));
            context.markSkillsPromptInjected();
            log.debug("[run:{}] injected skills prompt for {}", context.runId(), snapshot.visibleSkills());
        } catch (RuntimeException ex) {
            log.warn("[run:{}] failed to render skills prompt, continuing without it", context.runId(), ex);
        }
    }

    // ========= Model call =========

    public ModelCallRequest beforeModelCall(TurnContext context, ModelCallRequest request) {
        ModelCallRequest current = request == null ? ModelCallRequest.from(context) : request;
        if (context.skillsPromptInjected()) {
            current = current.withSystemPrompt(current.systemPrompt() + "\n\nCurrent time: " + clock.instant());
        }

        SkillSessionSnapshot snapshot = context.snapshot();
        if (snapshot == null || snapshot.visibleSkills().isEmpty()) {
            return current;
        }

        Set<String> activated = activatedSkills(context, current.messages());
        context.activatedSkills().addAll(activated);
        SkillDependencyBundle bundle = SkillDependencyBundle.of(activated, snapshot);
        context.dependencyBundle(bundle);

        Map<String, BaseTool> baseTools = current.tools();
        Map<String, BaseTool> tools = new LinkedHashMap<>(baseTools);
        for (String withheld : withheldTools(snapshot, activated)) {
            tools.remove(withheld);
        }
        if (bundle.isEmpty()) {
            return current.withTools(tools);
        }

        List<ToolName> missing = bundle.applyTo(
                tools,
                toolName -> Optional.ofNullable(baseTools.get(toolName.value())).or(() -> toolRegistry.find(toolName)),
                integration -> integrationTools(context, integration)
        );
        if (!missing.isEmpty()) {
            log.warn("[run:{}] activated skills {} require unknown tools {}", context.runId(), activated, missing);
        }
        log.debug("[run:{}] activated skills {} unlock {}", context.runId(), activated, bundle);
        return current.withTools(tools);
    }

    // ========= Tool call =========

    public JsonNode onToolCall(TurnContext context, PlannedToolCall call, Function<PlannedToolCall, JsonNode> handler) {
        if (call == null || !READ_FILE_TOOL.equalsIgnoreCase(trim(call.name()))) {
            return handler.apply(call);
        }
        String slug = manifestSlug(call.arguments());
        if (slug == null) {
            return handler.apply(call);
        }
        if (!context.visibleSkills().contains(slug)) {
            log.warn("[run:{}] denied SKILL.md read for skill not visible in this turn: {}", context.runId(), slug);
            return denial(slug);
        }
        if (context.activatedSkills().add(slug)) {
            log.info("[run:{}] activated skill '{}'", context.runId(), slug);
        }
        return handler.apply(call);
    }

    public String manifestSlug(Map<String, Object> arguments) {
        if (arguments == null) {
            return null;
        }
        Object raw = arguments.get("file_path");
        if (raw == null) {
            raw = arguments.get("path");
        }
        if (raw == null || !StringUtils.hasText(raw.toString())) {
            return null;
        }
        Matcher matcher = MANIFEST_PATH.matcher(withoutDotSegments(FilePaths.normalize(raw.toString())));
        return matcher.matches() ? matcher.group(1) : null;
    }

    private static String withoutDotSegments(String path) {
        StringBuilder builder = new StringBuilder();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            builder.append('/').append(segment);
        }
        return builder.length() == 0 ? "/" : builder.toString();
    }

    private Set<String> activatedSkills(TurnContext context, List<Message> messages) {
        Set<String> visible = new LinkedHashSet<>(context.visibleSkills());
        Set<String> activated = new LinkedHashSet<>();
        for (String slug : context.activatedSkills()) {
            if (visible.contains(slug)) {
                activated.add(slug);
            }
        }
        for (Message message : messages) {
            if (!(message instanceof AssistantMessage assistantMessage)
                    || assistantMessage.getToolCalls() == null
                    || assistantMessage.getToolCalls().isEmpty()) {
                continue;
            }
            for (AssistantMessage.ToolCall toolCall : assistantMessage.getToolCalls()) {
                if (!READ_FILE_TOOL.equalsIgnoreCase(trim(toolCall.name()))) {
                    continue;
                }
                String slug = manifestSlug(parseArguments(toolCall.arguments()));
                if (slug != null && visible.contains(slug)) {
                    activated.add(slug);
                }
            }
        }
        return activated;
    }

    private Set<String> withheldTools(SkillSessionSnapshot snapshot, Collection<String> activated) {
        Set<String> withheld = new LinkedHashSet<>();
        for (String slug : snapshot.visibleSkills()) {
            if (activated.contains(slug)) {
                continue;
            }
            for (ToolName toolName : snapshot.dependenciesOf(slug).tools()) {
                if (!READ_FILE_TOOL.equals(toolName.value())) {
                    withheld.add(toolName.value());
                }
            }
        }
        return withheld;
    }

    private List<BaseTool> integrationTools(TurnContext context, IntegrationName integration) {
        List<BaseTool> cached = context.integrationTools().get(integration);
        if (cached != null) {
            return cached;
        }
        try {
            List<BaseTool> loaded = integrationToolCatalog.loadTools(integration);
            context.integrationTools().put(integration, loaded);
            return loaded;
        } catch (RuntimeException ex) {
            log.warn("[run:{}] failed to load tools of integration '{}'", context.runId(), integration, ex);
            return List.of();
        }
    }

    private Map<String, Object> parseArguments(String json) {
        if (!StringUtils.hasText(json)) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, ARGS_TYPE);
            return parsed == null ? Map.of() : parsed;
        } catch (JsonProcessingException ex) {
            log.debug("Ignore tool call with unparsable arguments: {}", ex.getOriginalMessage());
            return Map.of();
        }
    }

    private JsonNode denial(String slug) {
        ObjectNode result = objectMapper.createObjectNode();
        result.put("tool", READ_FILE_TOOL);
        result.put("ok", false);
        result.put("code", SKILL_NOT_VISIBLE);
        result.put("error", "Skill '" + slug + "' is not available in this conversation");
        return result;
    }

    private static boolean hasReadFile(List<BaseTool> tools) {
        for (BaseTool tool : tools) {
            if (tool != null && READ_FILE_TOOL.equalsIgnoreCase(trim(tool.name()))) {
                return true;
            }
        }
        return false;
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
