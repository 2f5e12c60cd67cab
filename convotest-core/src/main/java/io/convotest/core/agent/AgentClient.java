package io.convotest.core.agent;

public interface AgentClient {

    String newSession();

    String sessionId();

    AgentReply sendMessage(String text) throws AgentClientException;
}
