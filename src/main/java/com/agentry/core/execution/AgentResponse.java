package com.agentry.core.execution;

/**
 * What an {@link AgentRuntime} reports back.
 *
 * @param success    whether the agent considered the task done
 * @param output     produced text, possibly partial
 * @param error      failure description when not successful
 * @param tokensUsed token count when the runtime reports one
 */
public record AgentResponse(boolean success, String output, String error, Integer tokensUsed) {

    public static AgentResponse ok(String output) {
        return new AgentResponse(true, output, null, null);
    }

    public static AgentResponse failure(String error) {
        return new AgentResponse(false, null, error, null);
    }
}
