package com.hellblazer.hexcrawl.simulation.entity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ability cooldowns.
 *
 * @author hal.hildebrand
 */
class AbilityBookTest {

    private AbilityBook book;

    @BeforeEach
    void setUp() {
        book = new AbilityBook(List.of(AbilityDefinition.attack("power_strike", "Power Strike", 20, 1, 2),
                                       AbilityDefinition.heal("mend", "Mend", 10, 2, 0)));
    }

    @Test
    void testUniversalAbilitiesInstalled() {
        assertTrue(book.has(AbilityDefinition.BASIC_ATTACK_ID));
        assertTrue(book.has(AbilityDefinition.WAIT_ID));
        assertEquals(4, book.getAll().size());
    }

    @Test
    void testCooldownStartsOnUse() {
        assertEquals(Optional.empty(), book.use("power_strike"));
        assertEquals(2, book.getCooldown("power_strike"));
        assertEquals(Optional.of("Ability 'Power Strike' is on cooldown (2 rounds remaining)"),
                     book.checkUsable("power_strike"));
        assertTrue(book.use("power_strike").isPresent());
        assertEquals(1, book.getUsageCount("power_strike"));
        assertFalse(book.getAvailable().stream().anyMatch(a -> a.id().equals("power_strike")));
    }

    @Test
    void testCooldownTicksDown() {
        book.use("power_strike");
        assertEquals(List.of(), book.processRound());
        assertEquals(1, book.getCooldown("power_strike"));
        assertEquals(List.of("power_strike"), book.processRound());
        assertFalse(book.isOnCooldown("power_strike"));
    }

    @Test
    void testZeroCooldownAlwaysUsable() {
        book.use("mend");
        book.use("mend");
        assertFalse(book.isOnCooldown("mend"));
        assertEquals(2, book.getUsageCount("mend"));
    }

    @Test
    void testUnknownAbility() {
        assertEquals(Optional.of("Ability 'fireball' does not exist"), book.checkUsable("fireball"));
    }

    @Test
    void testAvailableByKind() {
        var healing = book.getAvailable(AbilityKind.HEALING);
        assertEquals(1, healing.size());
        assertEquals("mend", healing.get(0).id());
    }

    @Test
    void testReset() {
        book.use("power_strike");
        book.reset();
        assertFalse(book.isOnCooldown("power_strike"));
        assertEquals(0, book.getUsageCount("power_strike"));
    }
}
