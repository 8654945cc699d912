package com.rpyflow.directives;

import com.rpyflow.settings.CompilerSettings;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registry of the directives a node may carry, with their types and defaults.
 */
public class DirectiveSchema {
    public static final String LABEL = "label";
    public static final String SPEAKER = "speaker";
    public static final String BEFORE = "before";
    public static final String AFTER = "after";
    public static final String CHOICE_INDEX = "choice_index";
    public static final String DISPLAY_TEXT_BOX = "display_text_box";
    public static final String MARKDOWN = "markdown";
    public static final String RELATIVE_IMGS_IN_BRACES = "relative_imgs_in_braces";
    public static final String REPEAT_MENU_TEXT = "repeat_menu_text";

    private final Map<String, DirectiveSpec> specs = new LinkedHashMap<>();

    public DirectiveSchema directive(String name, DirectiveSpec.Type type, Object defaultValue) {
        specs.put(name, new DirectiveSpec(name, type, defaultValue));
        return this;
    }

    /**
     * The directives understood by the compiler; boolean defaults come from the settings.
     */
    public static DirectiveSchema standard(CompilerSettings settings) {
        return new DirectiveSchema()
            .directive(LABEL, DirectiveSpec.Type.STRING, null)
            .directive(SPEAKER, DirectiveSpec.Type.STRING, null)
            .directive(BEFORE, DirectiveSpec.Type.STRING, null)
            .directive(AFTER, DirectiveSpec.Type.STRING, null)
            .directive(CHOICE_INDEX, DirectiveSpec.Type.INT, null)
            .directive(DISPLAY_TEXT_BOX, DirectiveSpec.Type.BOOLEAN, settings.isMenuDisplayTextBox())
            .directive(MARKDOWN, DirectiveSpec.Type.BOOLEAN, settings.isMarkdownTextStyles())
            .directive(RELATIVE_IMGS_IN_BRACES, DirectiveSpec.Type.BOOLEAN, settings.isRelativeImgsInBraces())
            .directive(REPEAT_MENU_TEXT, DirectiveSpec.Type.BOOLEAN, settings.isRepeatMenuText());
    }

    public boolean has(String name) {
        return name != null && specs.containsKey(name);
    }

    public DirectiveSpec get(String name) {
        return name != null ? specs.get(name) : null;
    }

    public Map<String, Object> defaults() {
        Map<String, Object> values = new LinkedHashMap<>();
        for (DirectiveSpec spec : specs.values()) {
            if (spec.getDefaultValue() != null) {
                values.put(spec.getName(), spec.getDefaultValue());
            }
        }
        return values;
    }
}
