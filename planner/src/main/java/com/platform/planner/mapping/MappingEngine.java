package com.platform.planner.mapping;

import com.platform.planner.error.SettingsCompilationException;
import com.platform.planner.settings.SettingEntry;
import com.platform.planner.settings.SettingTag;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders an ordered list of settings into a single wire payload.
 * 
 * Each setting is rendered through its tag's definition and merged into the
 * output: objects merge key by key, scalars are overwritten by the latest
 * setting, and lists accumulate in setting order. Compilation is a pure
 * function of the profile and the settings.
 */
public class MappingEngine {
    
    private static final String SCALAR_ITEM_FIELD = "value";
    
    private final SettingsCollator collator;
    
    public MappingEngine() {
        this(new SettingsCollator());
    }
    
    public MappingEngine(SettingsCollator collator) {
        this.collator = collator;
    }
    
    /**
     * Compiles settings against the definitions of a profile.
     *
     * @throws SettingsCompilationException if a tag is not mapped or a field cannot be resolved
     */
    public WireDto compile(SettingsProfile profile, List<SettingEntry> settings) {
        List<SettingEntry> effective = profile.requiresCollation()
            ? collator.collate(settings, profile.collations())
            : settings;
        
        Map<String, Object> dto = new TreeMap<>();
        for (SettingEntry setting : effective) {
            MapNode.Mapping definition = profile.definitions().get(setting.getTag());
            if (definition == null) {
                throw SettingsCompilationException.notMapped(setting.getTag(), profile.version());
            }
            render(setting.getTag(), definition, setting.getFields(), dto);
        }
        
        for (DtoPostProcessor postProcessor : profile.postProcessors()) {
            postProcessor.process(dto);
        }
        
        return new WireDto(dto);
    }
    
    Map<String, Object> render(SettingTag tag, MapNode.Mapping node, Map<String, Object> context, Map<String, Object> into) {
        for (Map.Entry<String, MapNode> field : node.fields().entrySet()) {
            String key = field.getKey();
            MapNode child = field.getValue();
            Object existing = into.get(key);
            
            if (child instanceof MapNode.Mapping mapping) {
                Map<String, Object> target = existing instanceof Map<?, ?> previous
                    ? WireValues.copyOf(previous)
                    : new TreeMap<>();
                into.put(key, render(tag, mapping, context, target));
            } else if (child instanceof MapNode.ListTemplate list) {
                List<Object> rendered = expand(tag, list, context);
                if (existing instanceof List<?> previous) {
                    List<Object> merged = new ArrayList<>(previous);
                    merged.addAll(rendered);
                    into.put(key, merged);
                } else {
                    into.put(key, rendered);
                }
            } else {
                into.put(key, resolve(tag, child, context));
            }
        }
        return into;
    }
    
    private List<Object> expand(SettingTag tag, MapNode.ListTemplate list, Map<String, Object> context) {
        List<Object> rendered = new ArrayList<>();
        
        if (!list.isGrouped()) {
            for (MapNode item : list.items()) {
                rendered.add(renderItem(tag, item, context));
            }
            return rendered;
        }
        
        Object group = context.get(list.group());
        if (group == null) {
            throw SettingsCompilationException.unresolved(tag, list.group());
        }
        if (!(group instanceof List<?> members)) {
            throw SettingsCompilationException.invalidValueMap(tag, list.group(), "group field is not a list");
        }
        
        for (MapNode item : list.items()) {
            for (Object member : members) {
                rendered.add(renderItem(tag, item, memberContext(context, member)));
            }
        }
        return rendered;
    }
    
    private Object renderItem(SettingTag tag, MapNode item, Map<String, Object> context) {
        if (item instanceof MapNode.Mapping mapping) {
            return render(tag, mapping, context, new TreeMap<>());
        }
        if (item instanceof MapNode.ListTemplate list) {
            return expand(tag, list, context);
        }
        return resolve(tag, item, context);
    }
    
    /**
     * Group members overlay the setting's fields. A scalar member is exposed
     * as {@code $value}.
     */
    private Map<String, Object> memberContext(Map<String, Object> context, Object member) {
        Map<String, Object> scoped = new HashMap<>(context);
        if (member instanceof Map<?, ?> fields) {
            fields.forEach((key, value) -> scoped.put(String.valueOf(key), value));
        } else {
            scoped.put(SCALAR_ITEM_FIELD, member);
        }
        return scoped;
    }
    
    private Object resolve(SettingTag tag, MapNode node, Map<String, Object> context) {
        if (node instanceof MapNode.Substitution substitution) {
            Object value = context.get(substitution.field());
            if (value == null) {
                throw SettingsCompilationException.unresolved(tag, substitution.field());
            }
            return WireValues.deepCopy(value);
        }
        
        if (node instanceof MapNode.Translation translation) {
            Object value = context.get(translation.field());
            if (value == null) {
                throw SettingsCompilationException.unresolved(tag, translation.field());
            }
            return translation.valueMap().translate(value)
                .orElseThrow(() -> SettingsCompilationException.invalidValueMap(tag, translation.field(),
                    String.format("value '%s' not resolvable through '%s'", value, translation.valueMap())));
        }
        
        if (node instanceof MapNode.Literal literal) {
            return WireValues.deepCopy(literal.value());
        }
        
        throw new IllegalStateException("Unexpected map node: " + node);
    }
}
