package com.linlay.capability.agent;

import com.linlay.capability.catalog.FrontmatterFields;
import com.linlay.capability.catalog.ResourceKind;

public class SubagentKind implements ResourceKind<Subagent> {

    public static final String AGENT_FILE = "AGENT.md";

    @Override
    public String name() {
        return "agent";
    }

    @Override
    public String definitionFileName() {
        return AGENT_FILE;
    }

    @Override
    public Subagent decode(FrontmatterFields fields) {
        return new Subagent(
                fields.text("name"),
                fields.text("description"),
                fields.stringList("allowed-tools"),
                fields.text("model"),
                fields.integer("max_actions"),
                fields.bool("thinking_enabled"),
                fields.longValue("thinking_budget"),
                fields.raw(),
                ""
        );
    }
}
