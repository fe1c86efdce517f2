package com.linlay.capability.skill;

import com.linlay.capability.catalog.CatalogException;
import com.linlay.capability.catalog.DiscoveryResult;
import com.linlay.capability.catalog.ResourceInfo;
import com.linlay.capability.catalog.ResourceRegistry;
import com.linlay.capability.catalog.SearchRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class SkillRegistryService implements SkillManager {

    private static final Logger log = LoggerFactory.getLogger(SkillRegistryService.class);

    private final ResourceRegistry<Skill> registry;

    @Autowired
    public SkillRegistryService(SkillCatalogProperties properties) {
        this(properties.searchRoots());
        if (properties.isDiscoverOnStartup()) {
            DiscoveryResult result = discoverSkills();
            log.info("Loaded {} skills from {}", result.totalCount(), result.rootsSearched());
        }
    }

    public SkillRegistryService(List<SearchRoot> roots) {
        this.registry = new ResourceRegistry<>(new SkillKind(), roots);
    }

    @Override
    public DiscoveryResult discoverSkills() {
        return registry.discover();
    }

    @Override
    public Skill loadSkillMetadata(String skillName) {
        return registry.loadFull(skillName);
    }

    @Override
    public boolean activateSkill(String skillName) {
        return registry.activate(skillName);
    }

    @Override
    public boolean deactivateSkill(String skillName) {
        return registry.deactivate(skillName);
    }

    @Override
    public boolean setSkillActive(String skillName, boolean active) {
        return registry.setActive(skillName, active);
    }

    @Override
    public List<ResourceInfo> getAvailableSkills() {
        return registry.listActive();
    }

    @Override
    public List<ResourceInfo> listSkills() {
        return registry.listAll();
    }

    @Override
    public ResourceInfo getSkillByName(String skillName) {
        return registry.getByName(skillName);
    }

    @Override
    public Map<String, CatalogException> validateSkills() {
        return registry.validateAll();
    }
}
