package com.linlay.capability.skill;

import com.linlay.capability.catalog.FrontmatterFields;
import com.linlay.capability.catalog.ResourceKind;

public class SkillKind implements ResourceKind<Skill> {

    public static final String SKILL_FILE = "SKILL.md";

    @Override
    public String name() {
        return "skill";
    }

    @Override
    public String definitionFileName() {
        return SKILL_FILE;
    }

    @Override
    public Skill decode(FrontmatterFields fields) {
        return new Skill(
                fields.text("name"),
                fields.text("description"),
                fields.stringList("allowed-tools"),
                fields.text("license"),
                fields.text("compatibility"),
                fields.stringMap("metadata"),
                fields.raw(),
                ""
        );
    }
}
