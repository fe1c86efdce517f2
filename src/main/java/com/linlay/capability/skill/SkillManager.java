package com.linlay.capability.skill;

import com.linlay.capability.catalog.CatalogException;
import com.linlay.capability.catalog.DiscoveryResult;
import com.linlay.capability.catalog.ResourceInfo;

import java.util.List;
import java.util.Map;

/**
 * Skill catalog as seen by the tool layer. Skills are discovered from disk and toggled
 * active by name; only active skills are offered for invocation.
 */
public interface SkillManager {

    DiscoveryResult discoverSkills();

    /**
     * Loads the full SKILL.md body for a skill, reading the file at most once per catalog entry.
     */
    Skill loadSkillMetadata(String skillName);

    boolean activateSkill(String skillName);

    boolean deactivateSkill(String skillName);

    /**
     * Activates or deactivates a discovered skill and reports whether its state changed.
     */
    boolean setSkillActive(String skillName, boolean active);

    List<ResourceInfo> getAvailableSkills();

    List<ResourceInfo> listSkills();

    ResourceInfo getSkillByName(String skillName);

    Map<String, CatalogException> validateSkills();
}
