package id.my.agungdh.metricsdashboard.parser;

/**
 * Character class nama metric/label: {@code [A-Za-z_:][A-Za-z0-9_:]*}.
 */
final class MetricNames {

    private MetricNames() {
    }

    static boolean isNameStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_' || c == ':';
    }

    static boolean isNameChar(char c) {
        return isNameStart(c) || (c >= '0' && c <= '9');
    }

    static boolean isValid(String s) {
        if (s == null || s.isEmpty() || !isNameStart(s.charAt(0))) return false;
        for (int i = 1; i < s.length(); i++) {
            if (!isNameChar(s.charAt(i))) return false;
        }
        return true;
    }

    /** Posisi setelah karakter nama terakhir yang dimulai di {@code from}; sama dengan {@code from} kalau tidak ada nama. */
    static int scanName(CharSequence s, int from) {
        int i = from;
        if (i >= s.length() || !isNameStart(s.charAt(i))) return from;
        i++;
        while (i < s.length() && isNameChar(s.charAt(i))) i++;
        return i;
    }
}
