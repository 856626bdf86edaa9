package com.esports.dashboard.infrastructure.persistence.jdbc;

import com.esports.dashboard.domain.model.RankedAccount;
import com.esports.dashboard.domain.model.RosterPlayer;
import com.esports.dashboard.domain.ranking.Tier;
import com.esports.dashboard.domain.ranking.Winrates;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes the json_agg columns of the leaderboard queries.
 *
 * LP from the database is raw; it is reduced to ranking LP (0 below MASTER) here.
 */
@Component
public class JsonColumns {

    private static final TypeReference<List<RosterJson>> ROSTER = new TypeReference<>() {
    };
    private static final TypeReference<List<AccountJson>> ACCOUNTS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JsonColumns(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public List<RosterPlayer> roster(String json) {
        List<RosterPlayer> players = new ArrayList<>();
        for (RosterJson row : read(json, ROSTER)) {
            players.add(RosterPlayer.builder()
                    .playerId(row.getPlayerId())
                    .slug(row.getSlug())
                    .pseudo(row.getPseudo())
                    .role(row.getRole())
                    .starter(row.isStarter())
                    .games(row.getGames())
                    .winrate(Winrates.percent(row.getWins(), row.getGames()))
                    .accounts(toAccounts(row.getAccounts()))
                    .build());
        }
        return players;
    }

    public List<RankedAccount> accounts(String json) {
        return toAccounts(read(json, ACCOUNTS));
    }

    private List<RankedAccount> toAccounts(List<AccountJson> rows) {
        List<RankedAccount> accounts = new ArrayList<>();
        if (rows == null) {
            return accounts;
        }
        for (AccountJson row : rows) {
            accounts.add(RankedAccount.builder()
                    .accountId(row.getAccountId())
                    .puuid(row.getPuuid())
                    .gameName(row.getGameName())
                    .tagLine(row.getTagLine())
                    .region(row.getRegion())
                    .tier(row.getTier())
                    .rank(row.getRank())
                    .lp(Tier.effectiveLp(row.getTier(), row.getLp()))
                    .games(row.getGames())
                    .wins(row.getWins())
                    .winrate(Winrates.percent(row.getWins(), row.getGames()))
                    .build());
        }
        return accounts;
    }

    private <T> List<T> read(String json, TypeReference<List<T>> type) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Unreadable JSON column from leaderboard query", e);
        }
    }

    @Data
    static class RosterJson {
        private int playerId;
        private String slug;
        private String pseudo;
        private String role;
        private boolean starter;
        private int games;
        private int wins;
        private List<AccountJson> accounts;
    }

    @Data
    static class AccountJson {
        private Integer accountId;
        private String puuid;
        private String gameName;
        private String tagLine;
        private String region;
        private String tier;
        private String rank;
        private Integer lp;
        private int games;
        private int wins;
    }
}
