package com.hellblazer.hexcrawl.simulation.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.hexcrawl.geometry.HexCoordinate;
import com.hellblazer.hexcrawl.simulation.ai.AIVariant;
import com.hellblazer.hexcrawl.simulation.ai.BehaviorAction;
import com.hellblazer.hexcrawl.simulation.ai.BehaviorCondition;
import com.hellblazer.hexcrawl.simulation.ai.MonsterBehavior;
import com.hellblazer.hexcrawl.simulation.entity.AbilityDefinition;
import com.hellblazer.hexcrawl.simulation.entity.AbilityKind;
import com.hellblazer.hexcrawl.simulation.entity.EntityStats;
import com.hellblazer.hexcrawl.simulation.entity.StatusEffectApplication;
import com.hellblazer.hexcrawl.simulation.entity.StatusEffectType;
import com.hellblazer.hexcrawl.simulation.threat.ThreatConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads monster definitions from JSON.
 * <p>
 * The document is either an array of definitions or an object with a {@code monsters} array. Each definition
 * requires {@code id}, {@code name}, {@code stats}, {@code abilities}, {@code aiVariant} (or {@code aiType}) and
 * {@code difficulty}:
 *
 * <pre>
 * {
 *   "id": "goblin_warrior",
 *   "name": "Goblin Warrior",
 *   "stats": { "maxHp": 45, "baseArmor": 1, "baseDamage": 12, "movementRange": 3 },
 *   "abilities": [ { "id": "rusty_slash", "kind": "attack", "damage": 12, "range": 1 } ],
 *   "aiVariant": "aggressive",
 *   "difficulty": 1,
 *   "behaviors": [ { "id": "flee", "priority": 9,
 *                    "conditions": [ { "type": "health_below", "value": 0.25 } ],
 *                    "action": { "type": "retreat" } } ]
 * }
 * </pre>
 *
 * Structural problems raise {@link IllegalArgumentException} naming the offending field.
 *
 * @author hal.hildebrand
 */
public class MonsterDefinitionLoader {
    public static final String DEFAULT_RESOURCE = "/monsters/default-monsters.json";

    private static final Logger log = LoggerFactory.getLogger(MonsterDefinitionLoader.class);

    private final ObjectMapper objectMapper;

    public MonsterDefinitionLoader() {
        this(new ObjectMapper());
    }

    public MonsterDefinitionLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the definitions bundled with the simulation
     */
    public List<MonsterDefinition> loadDefaults() {
        return loadResource(DEFAULT_RESOURCE);
    }

    /**
     * @param resource classpath resource, absolute
     * @throws UncheckedIOException     if the resource cannot be read
     * @throws IllegalArgumentException if it is missing or malformed
     */
    public List<MonsterDefinition> loadResource(String resource) {
        try (InputStream is = getClass().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalArgumentException("Monster definition resource not found: " + resource);
            }
            var definitions = load(is);
            log.info("Loaded {} monster definitions from {}", definitions.size(), resource);
            return definitions;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read monster definitions from " + resource, e);
        }
    }

    public List<MonsterDefinition> load(InputStream input) throws IOException {
        return parse(objectMapper.readTree(input));
    }

    public List<MonsterDefinition> parse(String json) throws IOException {
        return parse(objectMapper.readTree(json));
    }

    public List<MonsterDefinition> parse(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new IllegalArgumentException("Empty monster definition document");
        }
        var monsters = root.isArray() ? root : root.get("monsters");
        if (monsters == null || !monsters.isArray()) {
            throw new IllegalArgumentException("Missing required field: monsters");
        }
        var result = new ArrayList<MonsterDefinition>();
        for (var node : monsters) {
            result.add(parseDefinition(node));
        }
        return result;
    }

    public MonsterDefinition parseDefinition(JsonNode node) {
        var id = text(node, "id", "monster");
        var where = "monster " + id;
        var name = text(node, "name", where);
        var stats = parseStats(require(node, "stats", where), where);

        var abilities = new ArrayList<AbilityDefinition>();
        for (var ability : array(node, "abilities", where)) {
            abilities.add(parseAbility(ability, where));
        }

        var variantNode = node.hasNonNull("aiVariant") ? node.get("aiVariant") : node.get("aiType");
        if (variantNode == null || variantNode.isNull()) {
            throw new IllegalArgumentException("Missing required field: aiVariant (" + where + ")");
        }
        var variant = AIVariant.fromName(variantNode.asText())
                               .orElseThrow(() -> new IllegalArgumentException(
                               "Unknown aiVariant '" + variantNode.asText() + "' (" + where + ")"));

        var difficulty = require(node, "difficulty", where).asInt();
        var threatConfig = node.hasNonNull("threatConfig") ? parseThreatConfig(node.get("threatConfig"))
                                                           : ThreatConfig.defaultConfig();

        var behaviors = new ArrayList<MonsterBehavior>();
        if (node.hasNonNull("behaviors")) {
            for (var behavior : array(node, "behaviors", where)) {
                behaviors.add(parseBehavior(behavior, where));
            }
        }
        Set<String> tags = new LinkedHashSet<>();
        if (node.hasNonNull("tags")) {
            array(node, "tags", where).forEach(tag -> tags.add(tag.asText()));
        }

        return new MonsterDefinition(id, name, node.path("description").asText(""), stats, abilities, variant,
                                     threatConfig, node.path("spawnWeight").asInt(1), difficulty, behaviors, tags);
    }

    private EntityStats parseStats(JsonNode node, String where) {
        var context = "stats of " + where;
        return new EntityStats(require(node, "maxHp", context).asInt(), require(node, "baseArmor", context).asInt(),
                               require(node, "baseDamage", context).asInt(),
                               require(node, "movementRange", context).asInt());
    }

    private AbilityDefinition parseAbility(JsonNode node, String where) {
        var id = text(node, "id", "ability of " + where);
        var context = "ability " + id + " of " + where;
        var kindNode = node.hasNonNull("kind") ? node.get("kind") : node.get("variant");
        if (kindNode == null || kindNode.isNull()) {
            throw new IllegalArgumentException("Missing required field: kind (" + context + ")");
        }
        var effects = new ArrayList<StatusEffectApplication>();
        if (node.hasNonNull("statusEffects")) {
            for (var effect : array(node, "statusEffects", context)) {
                effects.add(parseStatusEffect(effect, context));
            }
        }
        return new AbilityDefinition(id, node.path("name").asText(id), parseKind(kindNode.asText(), context),
                                     node.path("damage").asInt(0), node.path("healing").asInt(0),
                                     node.path("range").asInt(1), node.path("cooldown").asInt(0),
                                     node.path("description").asText(""), node.path("areaOfEffect").asInt(0),
                                     effects);
    }

    private StatusEffectApplication parseStatusEffect(JsonNode node, String where) {
        var name = node.hasNonNull("type") ? node.get("type").asText() : text(node, "effectName", where);
        var type = StatusEffectType.fromName(name)
                                   .orElseThrow(() -> new IllegalArgumentException(
                                   "Unknown status effect '" + name + "' (" + where + ")"));
        return new StatusEffectApplication(type, require(node, "duration", where).asInt(),
                                           node.path("value").asInt(0), node.path("chance").asDouble(1.0));
    }

    private ThreatConfig parseThreatConfig(JsonNode node) {
        var defaults = ThreatConfig.defaultConfig();
        return ThreatConfig.builder()
                           .withEnabled(node.path("enabled").asBoolean(defaults.isEnabled()))
                           .withDecayRate(node.path("decayRate").asDouble(defaults.getDecayRate()))
                           .withHealingMultiplier(
                           node.path("healingMultiplier").asDouble(defaults.getHealingMultiplier()))
                           .withDamageMultiplier(node.path("damageMultiplier").asDouble(defaults.getDamageMultiplier()))
                           .withArmorMultiplier(node.path("armorMultiplier").asDouble(defaults.getArmorMultiplier()))
                           .withAvoidLastTargetRounds(
                           node.path("avoidLastTargetRounds").asInt(defaults.getAvoidLastTargetRounds()))
                           .withFallbackToLowestHp(
                           node.path("fallbackToLowestHp").asBoolean(defaults.isFallbackToLowestHp()))
                           .withTiebreaker(node.path("enableTiebreaker").asBoolean(defaults.isEnableTiebreaker()))
                           .build();
    }

    private MonsterBehavior parseBehavior(JsonNode node, String where) {
        var id = text(node, "id", "behavior of " + where);
        var context = "behavior " + id + " of " + where;
        var conditions = new ArrayList<BehaviorCondition>();
        if (node.hasNonNull("conditions")) {
            for (var condition : array(node, "conditions", context)) {
                conditions.add(parseCondition(condition, context));
            }
        }
        return new MonsterBehavior(id, node.path("name").asText(id), node.path("priority").asInt(0), conditions,
                                   parseAction(require(node, "action", context), context));
    }

    private BehaviorCondition parseCondition(JsonNode node, String where) {
        var type = text(node, "type", "condition of " + where).toLowerCase(Locale.ROOT);
        var value = require(node, "value", "condition " + type + " of " + where);
        return switch (type) {
            case "health_below" -> new BehaviorCondition.HealthBelow(value.asDouble());
            case "health_above" -> new BehaviorCondition.HealthAbove(value.asDouble());
            case "enemy_count_at_least" -> new BehaviorCondition.EnemyCountAtLeast(value.asInt());
            case "ally_count_at_least" -> new BehaviorCondition.AllyCountAtLeast(value.asInt());
            case "enemy_within" -> new BehaviorCondition.EnemyWithin(value.asInt());
            case "ally_in_danger" -> new BehaviorCondition.AllyInDanger(value.asDouble());
            case "round_at_least" -> new BehaviorCondition.RoundAtLeast(value.asInt());
            default -> throw new IllegalArgumentException("Unknown condition type '" + type + "' (" + where + ")");
        };
    }

    private BehaviorAction parseAction(JsonNode node, String where) {
        var name = text(node, "type", "action of " + where);
        BehaviorAction.Type type;
        try {
            type = BehaviorAction.Type.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown action type '" + name + "' (" + where + ")", e);
        }
        return switch (type) {
            case ATTACK_NEAREST -> new BehaviorAction.AttackNearest();
            case FOCUS_WEAKEST -> new BehaviorAction.FocusWeakest();
            case RETREAT -> new BehaviorAction.Retreat();
            case USE_ABILITY -> new BehaviorAction.UseAbility(text(node, "abilityId", where));
            case MOVE_TO -> new BehaviorAction.MoveTo(
            HexCoordinate.of(require(node, "q", where).asInt(), require(node, "r", where).asInt()));
            case HOLD -> new BehaviorAction.Hold();
        };
    }

    private static AbilityKind parseKind(String name, String where) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "attack" -> AbilityKind.ATTACK;
            case "defense", "defensive", "support" -> AbilityKind.DEFENSE;
            case "utility", "movement" -> AbilityKind.UTILITY;
            case "healing", "heal" -> AbilityKind.HEALING;
            default -> throw new IllegalArgumentException("Unknown ability kind '" + name + "' (" + where + ")");
        };
    }

    private static JsonNode require(JsonNode node, String field, String where) {
        var value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing required field: " + field + " (" + where + ")");
        }
        return value;
    }

    private static String text(JsonNode node, String field, String where) {
        var value = require(node, field, where).asText();
        if (value.isBlank()) {
            throw new IllegalArgumentException("Missing required field: " + field + " (" + where + ")");
        }
        return value;
    }

    private static JsonNode array(JsonNode node, String field, String where) {
        var value = require(node, field, where);
        if (!value.isArray()) {
            throw new IllegalArgumentException("Field " + field + " must be an array (" + where + ")");
        }
        return value;
    }
}
