package com.redhat.ci.resources.util;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public class ResourceNameUtils {

    public static final int MAX_LABEL_LENGTH = 63;

    static final String TRUNCATION_MARKER = "XXX";

    /**
     * Returns a copy of the labels where every value is short enough to be a valid label value. Long values
     * keep their first 60 characters followed by {@value #TRUNCATION_MARKER}.
     */
    public static Map<String, String> trimLabels(Map<String, String> labels) {
        Map<String, String> result = new LinkedHashMap<>();
        for (var e : labels.entrySet()) {
            result.put(e.getKey(), trimLabelValue(e.getValue()));
        }
        return result;
    }

    public static String trimLabelValue(String value) {
        if (value == null || value.length() <= MAX_LABEL_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_LABEL_LENGTH - TRUNCATION_MARKER.length()) + TRUNCATION_MARKER;
    }

    /**
     * The name of the parameter holding the image of a pipeline tag, e.g. {@code IMAGE_SRC} for
     * {@code src} or {@code IMAGE_MACHINE_OS_CONTENT} for {@code machine-os-content}.
     */
    public static String pipelineImageEnvFor(String tag) {
        return "IMAGE_" + tag.replace('-', '_').toUpperCase(Locale.ROOT);
    }
}
