package org.arpha.util;

public final class StringUtils {

    private StringUtils() {
    }

    public static String stripLeading(String value, char stripped) {
        int start = 0;
        while (start < value.length() && value.charAt(start) == stripped) {
            start++;
        }
        return value.substring(start);
    }

    public static String stripTrailing(String value, char stripped) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == stripped) {
            end--;
        }
        return value.substring(0, end);
    }

}
