package tech.compendium.queue.embedded;

/**
 * AMQP topic-exchange routing-key matching.
 * Keys and patterns are dot-separated words; {@code *} matches exactly one word, {@code #} zero or more.
 */
public final class TopicMatcher {

    private TopicMatcher() {
    }

    public static boolean matches(String pattern, String routingKey) {
        String[] patternWords = pattern.split("\\.", -1);
        String[] keyWords = routingKey.isEmpty() ? new String[0] : routingKey.split("\\.", -1);
        return match(patternWords, 0, keyWords, 0);
    }

    private static boolean match(String[] pattern, int pi, String[] key, int ki) {
        if (pi == pattern.length) {
            return ki == key.length;
        }

        String word = pattern[pi];
        if (word.equals("#")) {
            for (int next = ki; next <= key.length; next++) {
                if (match(pattern, pi + 1, key, next)) {
                    return true;
                }
            }
            return false;
        }

        if (ki == key.length) {
            return false;
        }
        if (word.equals("*") || word.equals(key[ki])) {
            return match(pattern, pi + 1, key, ki + 1);
        }
        return false;
    }
}
