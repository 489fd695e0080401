package org.fitch.support;

import java.util.Comparator;

/**
 * Confronto "naturale" tra stringhe: le sequenze di cifre sono confrontate
 * come numeri, il resto carattere per carattere.
 *
 * Così "Line 2: ..." precede "Line 10: ...". A parità numerica vince la
 * sequenza di cifre più corta ("7" prima di "007"), e come ultima risorsa
 * si usa l'ordine lessicografico semplice, per restare coerenti con equals.
 */
public final class NaturalOrderComparator implements Comparator<String> {

    public static final NaturalOrderComparator INSTANCE = new NaturalOrderComparator();

    private NaturalOrderComparator() {
    }

    @Override
    public int compare(String a, String b) {
        int i = 0;
        int j = 0;

        while (i < a.length() && j < b.length()) {
            char ca = a.charAt(i);
            char cb = b.charAt(j);

            if (Character.isDigit(ca) && Character.isDigit(cb)) {
                int endA = digitRunEnd(a, i);
                int endB = digitRunEnd(b, j);
                int result = compareDigitRuns(a.substring(i, endA), b.substring(j, endB));
                if (result != 0) {
                    return result;
                }
                i = endA;
                j = endB;
            } else {
                if (ca != cb) {
                    return Character.compare(ca, cb);
                }
                i++;
                j++;
            }
        }

        int remaining = Integer.compare(a.length() - i, b.length() - j);
        return remaining != 0 ? remaining : a.compareTo(b);
    }

    private static int digitRunEnd(String s, int start) {
        int end = start;
        while (end < s.length() && Character.isDigit(s.charAt(end))) {
            end++;
        }
        return end;
    }

    /**
     * Confronta due sequenze di cifre senza convertirle, per non avere limiti di grandezza.
     */
    private static int compareDigitRuns(String runA, String runB) {
        String valueA = stripLeadingZeros(runA);
        String valueB = stripLeadingZeros(runB);

        if (valueA.length() != valueB.length()) {
            return Integer.compare(valueA.length(), valueB.length());
        }
        int byValue = valueA.compareTo(valueB);
        if (byValue != 0) {
            return byValue;
        }
        return Integer.compare(runA.length(), runB.length());
    }

    private static String stripLeadingZeros(String run) {
        int k = 0;
        while (k < run.length() - 1 && run.charAt(k) == '0') {
            k++;
        }
        return run.substring(k);
    }
}
