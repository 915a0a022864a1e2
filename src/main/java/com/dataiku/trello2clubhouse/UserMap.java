package com.dataiku.trello2clubhouse;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

/**
 * Read only translation of Trello member ids into Clubhouse member ids.
 *
 * <p>Built once before any card is processed, see {@link TrelloUserMapping}.
 */
public class UserMap {

    private final ImmutableMap<String, UUID> clubhouseIdByTrelloId;
    private final UUID defaultClubhouseId;

    private UserMap(Map<String, UUID> clubhouseIdByTrelloId, UUID defaultClubhouseId) {
        this.clubhouseIdByTrelloId = ImmutableMap.copyOf(clubhouseIdByTrelloId);
        this.defaultClubhouseId = defaultClubhouseId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<UUID> lookup(String trelloMemberId) {
        if (Strings.isNullOrEmpty(trelloMemberId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(clubhouseIdByTrelloId.get(trelloMemberId));
    }

    /**
     * Mapped member, or the default member when the Trello member is unknown. May be {@code null} without default.
     */
    public UUID getClubhouseId(String trelloMemberId) {
        return lookup(trelloMemberId).orElse(defaultClubhouseId);
    }

    public UUID getDefaultClubhouseId() {
        return defaultClubhouseId;
    }

    public int size() {
        return clubhouseIdByTrelloId.size();
    }

    public static class Builder {
        private final Map<String, UUID> mappings = new LinkedHashMap<>();
        private UUID defaultClubhouseId;

        private Builder() {
        }

        /**
         * Later mappings of the same Trello member replace earlier ones.
         */
        public Builder put(String trelloMemberId, UUID clubhouseMemberId) {
            mappings.put(trelloMemberId, clubhouseMemberId);
            return this;
        }

        public Builder defaultMember(UUID clubhouseMemberId) {
            this.defaultClubhouseId = clubhouseMemberId;
            return this;
        }

        public UserMap build() {
            return new UserMap(mappings, defaultClubhouseId);
        }
    }
}
