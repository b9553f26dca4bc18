package com.linlay.sessionrelay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/* 在 nix 环境中启动时可以改写命令前缀
```yaml
agent:
  cli:
    command: [nix, develop, --command, claude]
```
*/

@ConfigurationProperties(prefix = "agent.cli")
public class AgentCliProperties {

    private List<String> command = new ArrayList<>(List.of("claude"));
    private String permissionMode = "bypassPermissions";
    private boolean skipPermissions = true;
    private boolean includePartialMessages = true;
    private String appendSystemPrompt = "Your responses must always be accurate and concise.";
    private List<String> extraArgs = new ArrayList<>();
    private long exitGraceMs = 5_000;
    private long commandTimeoutMs = 600_000;
    private int stderrLimitChars = 8_000;

    public List<String> getCommand() {
        return command;
    }

    public void setCommand(List<String> command) {
        this.command = command == null ? new ArrayList<>() : new ArrayList<>(command);
    }

    public String getPermissionMode() {
        return permissionMode;
    }

    public void setPermissionMode(String permissionMode) {
        this.permissionMode = permissionMode;
    }

    public boolean isSkipPermissions() {
        return skipPermissions;
    }

    public void setSkipPermissions(boolean skipPermissions) {
        this.skipPermissions = skipPermissions;
    }

    public boolean isIncludePartialMessages() {
        return includePartialMessages;
    }

    public void setIncludePartialMessages(boolean includePartialMessages) {
        this.includePartialMessages = includePartialMessages;
    }

    public String getAppendSystemPrompt() {
        return appendSystemPrompt;
    }

    public void setAppendSystemPrompt(String appendSystemPrompt) {
        this.appendSystemPrompt = appendSystemPrompt;
    }

    public List<String> getExtraArgs() {
        return extraArgs;
    }

    public void setExtraArgs(List<String> extraArgs) {
        this.extraArgs = extraArgs == null ? new ArrayList<>() : new ArrayList<>(extraArgs);
    }

    public long getExitGraceMs() {
        return exitGraceMs;
    }

    public void setExitGraceMs(long exitGraceMs) {
        this.exitGraceMs = exitGraceMs;
    }

    public long getCommandTimeoutMs() {
        return commandTimeoutMs;
    }

    public void setCommandTimeoutMs(long commandTimeoutMs) {
        this.commandTimeoutMs = commandTimeoutMs;
    }

    public int getStderrLimitChars() {
        return stderrLimitChars;
    }

    public void setStderrLimitChars(int stderrLimitChars) {
        this.stderrLimitChars = stderrLimitChars;
    }
}
