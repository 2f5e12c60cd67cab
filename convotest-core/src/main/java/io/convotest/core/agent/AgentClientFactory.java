package io.convotest.core.agent;

@FunctionalInterface
public interface AgentClientFactory {

    AgentClient create();
}
