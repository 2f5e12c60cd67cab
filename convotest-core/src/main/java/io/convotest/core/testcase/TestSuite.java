package io.convotest.core.testcase;

import java.util.List;
import java.util.Optional;

public record TestSuite(String name, List<GoalTestCase> tests) {
    public TestSuite {
        name = name == null ? "" : name;
        tests = tests == null ? List.of() : List.copyOf(tests);
    }

    public Optional<GoalTestCase> find(String testId) {
        return tests.stream().filter(test -> test.id().equals(testId)).findFirst();
    }

    public TestSuite select(List<String> testIds) {
        if (testIds == null || testIds.isEmpty()) {
            return this;
        }
        return new TestSuite(name, tests.stream().filter(test -> testIds.contains(test.id())).toList());
    }
}
