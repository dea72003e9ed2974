package com.seamtalk.config.hotkey;

import com.seamtalk.service.hotkey.KeyNameMapper;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates TalkKeyProperties against the key allow-list at startup to fail fast with
 * actionable messages. Every binding must name a distinct key.
 */
@Component
@ConditionalOnProperty(prefix = "client", name = "enabled", havingValue = "true")
class TalkKeyConfigurationValidator {

    private final TalkKeyProperties props;

    TalkKeyConfigurationValidator(TalkKeyProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validate() {
        List<String[]> bindings = new ArrayList<>();
        bindings.add(new String[]{"talk-keys.side-a-key", props.getSideAKey()});
        bindings.add(new String[]{"talk-keys.side-b-key", props.getSideBKey()});
        if (props.getAutoKey() != null) {
            bindings.add(new String[]{"talk-keys.auto-key", props.getAutoKey()});
        }
        Set<String> seen = new HashSet<>();
        for (String[] b : bindings) {
            if (!KeyNameMapper.isValidKey(b[1])) {
                throw new IllegalArgumentException("Invalid " + b[0] + ": '" + b[1]
                        + "'. Must be A-Z, 0-9, F1..F24, a known special "
                        + "(ESCAPE, ENTER, TAB, SPACE, BACKSPACE) or a LEFT/RIGHT modifier.");
            }
            if (!seen.add(KeyNameMapper.normalizeKey(b[1]))) {
                throw new IllegalArgumentException("Duplicate talk key '" + b[1] + "' in " + b[0]
                        + "; each binding needs its own key.");
            }
        }
    }
}
