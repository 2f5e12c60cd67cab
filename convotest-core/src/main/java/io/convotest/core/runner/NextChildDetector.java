package io.convotest.core.runner;

import java.util.regex.Pattern;

final class NextChildDetector {
    private static final Pattern NEXT_CHILD = Pattern.compile(
        "\\b(next|other|second|third)\\s+(child|kid|patient)\\b",
        Pattern.CASE_INSENSITIVE
    );

    private NextChildDetector() {
    }

    static boolean mentionsNextChild(String agentUtterance) {
        return agentUtterance != null && NEXT_CHILD.matcher(agentUtterance).find();
    }

    static int advance(String agentUtterance, int currentIndex, int childCount) {
        if (mentionsNextChild(agentUtterance) && currentIndex < childCount - 1) {
            return currentIndex + 1;
        }
        return currentIndex;
    }
}
