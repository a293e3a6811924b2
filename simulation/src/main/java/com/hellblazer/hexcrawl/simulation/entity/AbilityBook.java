package com.hellblazer.hexcrawl.simulation.entity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Abilities known to one entity and their cooldowns.
 * <p>
 * Every book contains {@link AbilityDefinition#BASIC_ATTACK} and {@link AbilityDefinition#WAIT} in addition to the
 * class abilities it is built with; a class ability with the same id replaces the built-in.
 *
 * @author hal.hildebrand
 */
public class AbilityBook {

    private final Map<String, AbilityDefinition> abilities = new LinkedHashMap<>();
    private final List<AbilityDefinition>        classAbilities;
    private final Map<String, Integer>           cooldowns = new LinkedHashMap<>();
    private final Map<String, Integer>           usage     = new HashMap<>();

    public AbilityBook(Collection<AbilityDefinition> classAbilities) {
        this.classAbilities = List.copyOf(classAbilities);
        install();
    }

    public Optional<AbilityDefinition> get(String abilityId) {
        return Optional.ofNullable(abilities.get(abilityId));
    }

    public boolean has(String abilityId) {
        return abilities.containsKey(abilityId);
    }

    public List<AbilityDefinition> getAll() {
        return List.copyOf(abilities.values());
    }

    /**
     * @return abilities off cooldown
     */
    public List<AbilityDefinition> getAvailable() {
        return abilities.values().stream().filter(a -> !isOnCooldown(a.id())).toList();
    }

    public List<AbilityDefinition> getAvailable(AbilityKind kind) {
        return getAvailable().stream().filter(a -> a.kind() == kind).toList();
    }

    public int getCooldown(String abilityId) {
        return cooldowns.getOrDefault(abilityId, 0);
    }

    public boolean isOnCooldown(String abilityId) {
        return getCooldown(abilityId) > 0;
    }

    /**
     * @return why the ability cannot be used now, or empty if it can
     */
    public Optional<String> checkUsable(String abilityId) {
        var ability = abilities.get(abilityId);
        if (ability == null) {
            return Optional.of("Ability '" + abilityId + "' does not exist");
        }
        if (isOnCooldown(abilityId)) {
            return Optional.of(String.format("Ability '%s' is on cooldown (%d rounds remaining)", ability.name(),
                                             getCooldown(abilityId)));
        }
        return Optional.empty();
    }

    /**
     * Start the ability's cooldown and count the use.
     *
     * @return why the ability could not be used, or empty on success
     */
    public Optional<String> use(String abilityId) {
        var refusal = checkUsable(abilityId);
        if (refusal.isPresent()) {
            return refusal;
        }
        var ability = abilities.get(abilityId);
        if (ability.cooldown() > 0) {
            cooldowns.put(abilityId, ability.cooldown());
        }
        usage.merge(abilityId, 1, Integer::sum);
        return Optional.empty();
    }

    public int getUsageCount(String abilityId) {
        return usage.getOrDefault(abilityId, 0);
    }

    public void setCooldown(String abilityId, int rounds) {
        if (rounds > 0) {
            cooldowns.put(abilityId, rounds);
        } else {
            cooldowns.remove(abilityId);
        }
    }

    /**
     * Count every cooldown down by one round.
     *
     * @return abilities that came off cooldown
     */
    public List<String> processRound() {
        var ready = new ArrayList<String>();
        var iterator = cooldowns.entrySet().iterator();
        while (iterator.hasNext()) {
            var entry = iterator.next();
            if (entry.getValue() <= 1) {
                iterator.remove();
                ready.add(entry.getKey());
            } else {
                entry.setValue(entry.getValue() - 1);
            }
        }
        return ready;
    }

    /**
     * Clear cooldowns and usage counts.
     */
    public void reset() {
        cooldowns.clear();
        usage.clear();
        install();
    }

    private void install() {
        abilities.clear();
        abilities.put(AbilityDefinition.BASIC_ATTACK_ID, AbilityDefinition.BASIC_ATTACK);
        abilities.put(AbilityDefinition.WAIT_ID, AbilityDefinition.WAIT);
        for (var ability : classAbilities) {
            abilities.put(ability.id(), ability);
        }
    }
}
