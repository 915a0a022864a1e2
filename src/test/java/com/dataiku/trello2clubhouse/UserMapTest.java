package com.dataiku.trello2clubhouse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.Test;

public class UserMapTest {

    private static final UUID ALICE = UUID.randomUUID();
    private static final UUID IMPORTER = UUID.randomUUID();

    @Test
    void shouldTranslateKnownMembers() {
        UserMap userMap = UserMap.builder().put("u1", ALICE).defaultMember(IMPORTER).build();

        assertEquals(Optional.of(ALICE), userMap.lookup("u1"));
        assertEquals(ALICE, userMap.getClubhouseId("u1"));
        assertEquals(1, userMap.size());
    }

    @Test
    void shouldFallBackToDefaultMember() {
        UserMap userMap = UserMap.builder().put("u1", ALICE).defaultMember(IMPORTER).build();

        assertFalse(userMap.lookup("u2").isPresent());
        assertFalse(userMap.lookup(null).isPresent());
        assertEquals(IMPORTER, userMap.getClubhouseId("u2"));
        assertEquals(IMPORTER, userMap.getClubhouseId(""));
    }

    @Test
    void shouldReturnNullWithoutDefaultMember() {
        UserMap userMap = UserMap.builder().build();

        assertNull(userMap.getClubhouseId("u1"));
        assertNull(userMap.getDefaultClubhouseId());
    }

    @Test
    void shouldKeepLastMappingOfSameMember() {
        UUID other = UUID.randomUUID();
        UserMap userMap = UserMap.builder().put("u1", ALICE).put("u1", other).build();

        assertEquals(other, userMap.getClubhouseId("u1"));
    }
}
