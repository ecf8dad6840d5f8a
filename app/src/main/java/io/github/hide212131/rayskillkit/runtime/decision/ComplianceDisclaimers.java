package io.github.hide212131.rayskillkit.runtime.decision;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ヘルス系スキルの結果に添える規制上の注意書き。
 */
public final class ComplianceDisclaimers {

    public static final String EN_US = "en-US";
    public static final String ZH_CN = "zh-CN";

    private static final List<String> ENGLISH = List.of(
            "This information is for general awareness only and does not constitute medical advice.",
            "Please consult a healthcare professional for medical concerns.");

    private static final List<String> CHINESE = List.of(
            "本信息仅供一般参考，不构成医疗建议。",
            "如有健康问题，请咨询专业医疗人员。");

    private ComplianceDisclaimers() {
    }

    public static List<String> forLocale(String locale) {
        return ZH_CN.equalsIgnoreCase(locale) ? CHINESE : ENGLISH;
    }

    /** Locale to notices, as attached to decision metadata. */
    public static Map<String, List<String>> asMetadata() {
        Map<String, List<String>> disclaimers = new LinkedHashMap<>();
        disclaimers.put(EN_US, ENGLISH);
        disclaimers.put(ZH_CN, CHINESE);
        return disclaimers;
    }

    /** Appends the English and Chinese notices after a blank line. */
    public static String appendTo(String message) {
        String notice = String.join(" ", ENGLISH) + "\n" + String.join("", CHINESE);
        if (message == null || message.isEmpty()) {
            return notice;
        }
        return message + "\n\n" + notice;
    }
}
