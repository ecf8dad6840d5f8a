package io.github.hide212131.rayskillkit.runtime.localization;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * English summary of a skill result with its Simplified Chinese counterpart.
 */
public record LocalizedSkillSummary(String english, String zhCN) {

    public LocalizedSkillSummary {
        Objects.requireNonNull(english, "english");
        Objects.requireNonNull(zhCN, "zhCN");
    }

    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("en-US", english);
        map.put("zh-CN", zhCN);
        return map;
    }

    public boolean isChineseTranslationAvailable() {
        return !zhCN.isBlank();
    }
}
