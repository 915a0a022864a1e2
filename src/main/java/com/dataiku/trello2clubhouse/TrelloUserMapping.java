package com.dataiku.trello2clubhouse;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.logging.Logger;

import com.dataiku.trello2clubhouse.clubhouse.Member;
import com.dataiku.trello2clubhouse.clubhouse.Profile;
import com.dataiku.trello2clubhouse.trello.TrelloMember;
import com.google.common.base.Preconditions;

/**
 * Matches the members of a Trello board with Clubhouse members to build the {@link UserMap}.
 *
 * <p>An explicit mapping (Trello username to Clubhouse mention name) wins, otherwise the Trello username or full name
 * is compared with the Clubhouse mention name and name.
 */
public class TrelloUserMapping {

    private static final Logger logger = Logger.getLogger("com.dataiku.trello2clubhouse.users");

    private final List<Member> clubhouseMembers;
    private final Map<String, String> clubhouseNameByTrelloLogin = new HashMap<>();

    public TrelloUserMapping(List<Member> clubhouseMembers, Map<String, String> userMappings) {
        this.clubhouseMembers = clubhouseMembers;
        if (userMappings != null) {
            this.clubhouseNameByTrelloLogin.putAll(userMappings);
        }
    }

    public UserMap buildUserMap(List<TrelloMember> trelloMembers, UUID defaultMember) {
        UserMap.Builder builder = UserMap.builder().defaultMember(defaultMember);
        for (TrelloMember trelloMember : trelloMembers) {
            Member member = findMember(trelloMember);
            if (member == null) {
                logger.warning("Missing trello->clubhouse user mapping for " + trelloMember.getUsername() + " (" + trelloMember.getFullName() + ")");
            } else {
                builder.put(trelloMember.getId(), member.id);
            }
        }
        UserMap userMap = builder.build();
        logger.info("Mapped " + userMap.size() + " of " + trelloMembers.size() + " Trello members to Clubhouse members");
        return userMap;
    }

    private Member findMember(TrelloMember trelloMember) {
        String clubhouseName = clubhouseNameByTrelloLogin.get(trelloMember.getUsername());
        if (clubhouseName != null) {
            for (Member member : clubhouseMembers) {
                if (member.profile != null && equalsIgnoreCase(clubhouseName, member.profile.mention_name)) {
                    return member;
                }
            }
            logger.warning("Clubhouse member '" + clubhouseName + "' mapped to " + trelloMember.getUsername() + " does not exist");
        }
        for (Member member : clubhouseMembers) {
            if (matches(member, trelloMember)) {
                return member;
            }
        }
        return null;
    }

    private static boolean matches(Member clubhouseMember, TrelloMember trelloMember) {
        Preconditions.checkNotNull(clubhouseMember);
        Preconditions.checkNotNull(trelloMember);

        Profile profile = clubhouseMember.profile;
        if (profile == null) {
            return false;
        }
        if (equalsIgnoreCase(trelloMember.getUsername(), profile.mention_name) || equalsIgnoreCase(trelloMember.getFullName(), profile.mention_name)) {
            return true;
        }
        return equalsIgnoreCase(trelloMember.getUsername(), profile.name) || equalsIgnoreCase(trelloMember.getFullName(), profile.name);
    }

    private static boolean equalsIgnoreCase(String str1, String str2) {
        return str1 != null && str1.equalsIgnoreCase(str2);
    }
}
