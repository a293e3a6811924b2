package com.hellblazer.hexcrawl.simulation.entity;

import com.hellblazer.hexcrawl.geometry.HexCoordinate;
import com.hellblazer.hexcrawl.simulation.ai.AIDecision;
import com.hellblazer.hexcrawl.simulation.ai.AIVariant;
import com.hellblazer.hexcrawl.simulation.ai.DecisionContext;
import com.hellblazer.hexcrawl.simulation.ai.MonsterAI;
import com.hellblazer.hexcrawl.simulation.ai.MonsterBehavior;
import com.hellblazer.hexcrawl.simulation.threat.ThreatCalculator;
import com.hellblazer.hexcrawl.simulation.threat.ThreatConfig;
import com.hellblazer.hexcrawl.simulation.threat.ThreatManager;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * An AI-controlled combatant with its own threat table.
 * <p>
 * Threat decays at the end of every round, after status effects and cooldowns have ticked.
 *
 * @author hal.hildebrand
 */
public class Monster extends AbstractCombatEntity {

    private final String        definitionId;
    private final ThreatManager threat;
    private final MonsterAI     ai;

    public Monster(String id, String name, EntityStats stats, Collection<AbilityDefinition> abilities,
                   HexCoordinate position, AIVariant variant, ThreatConfig threatConfig) {
        this(id, name, id, stats, abilities, position, new MonsterAI(variant), new ThreatManager(threatConfig));
    }

    public Monster(String id, String name, String definitionId, EntityStats stats,
                   Collection<AbilityDefinition> abilities, HexCoordinate position, AIVariant variant,
                   ThreatConfig threatConfig, List<MonsterBehavior> behaviors) {
        this(id, name, definitionId, stats, abilities, position, new MonsterAI(variant, behaviors),
             new ThreatManager(threatConfig));
    }

    protected Monster(String id, String name, String definitionId, EntityStats stats,
                      Collection<AbilityDefinition> abilities, HexCoordinate position, MonsterAI ai,
                      ThreatManager threat) {
        super(id, name, EntityKind.MONSTER, stats, abilities, position);
        this.definitionId = definitionId == null ? id : definitionId;
        this.ai = Objects.requireNonNull(ai, "ai");
        this.threat = Objects.requireNonNull(threat, "threat");
    }

    /**
     * @param context the board as seen by this monster
     * @return this round's decision
     */
    public AIDecision decide(DecisionContext context) {
        return ai.decide(this, threat, context);
    }

    /**
     * A player hurt this monster with an attack.
     *
     * @param damage hit points the attack actually removed
     */
    public void recordPlayerAttack(CombatEntity player, int damage) {
        threat.addThreat(ThreatCalculator.attack(player.getId(), damage, player.getEffectiveArmor()));
    }

    /**
     * A player hurt this monster, and possibly others, with an ability.
     *
     * @param damageToMonster  hit points removed from this monster
     * @param totalDamageDealt hit points removed across every target of the ability
     * @param targetsHit       entities hit, more than one for area abilities
     */
    public void recordPlayerAbility(CombatEntity player, String abilityId, int damageToMonster, int totalDamageDealt,
                                    int targetsHit) {
        var armor = player.getEffectiveArmor();
        threat.addThreat(targetsHit > 1 ? ThreatCalculator.areaOfEffect(player.getId(), damageToMonster,
                                                                        totalDamageDealt, targetsHit, armor,
                                                                        abilityId)
                                        : ThreatCalculator.ability(player.getId(), damageToMonster, totalDamageDealt,
                                                                   0, armor, abilityId));
    }

    /**
     * A player healed someone in sight of this monster.
     */
    public void recordPlayerHealing(CombatEntity player, int healing) {
        threat.addThreat(ThreatCalculator.healing(player.getId(), healing, player.getEffectiveArmor()));
    }

    public ThreatManager getThreatManager() {
        return threat;
    }

    public MonsterAI getAI() {
        return ai;
    }

    public AIVariant getVariant() {
        return ai.getVariant();
    }

    public String getDefinitionId() {
        return definitionId;
    }

    @Override
    protected void onRoundProcessed() {
        threat.processRound();
    }

    @Override
    public void resetForEncounter(HexCoordinate startingPosition) {
        super.resetForEncounter(startingPosition);
        threat.resetForEncounter();
        ai.reset();
    }
}
