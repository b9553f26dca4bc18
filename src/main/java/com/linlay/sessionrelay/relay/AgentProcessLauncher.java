package com.linlay.sessionrelay.relay;

public interface AgentProcessLauncher {

    AgentProcess launch(AgentLaunchSpec spec);
}
