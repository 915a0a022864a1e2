package com.dataiku.trello2clubhouse;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.dataiku.trello2clubhouse.trello.Trello;
import com.dataiku.trello2clubhouse.trello.TrelloCard;
import com.dataiku.trello2clubhouse.trello.TrelloList;

/**
 * Normalizes the open cards of a board, optionally restricted to some lists. Cards come out in board order whatever
 * the number of threads.
 */
public class BoardExporter {

    private static final Logger logger = Logger.getLogger("com.dataiku.trello2clubhouse.export");

    private final Trello trello;
    private final CardNormalizer normalizer;

    public BoardExporter(Trello trello, CardNormalizer normalizer) {
        this.trello = trello;
        this.normalizer = normalizer;
    }

    public List<Card> export(String boardId, List<String> listNames, int threads) throws IOException {
        List<TrelloCard> trelloCards = selectCards(boardId, listNames);
        logger.info("Exporting " + trelloCards.size() + " cards of board " + boardId + "...");

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Future<Card>> futures = new ArrayList<>();
        for (TrelloCard trelloCard : trelloCards) {
            futures.add(executor.submit(() -> normalizer.normalize(trelloCard)));
        }
        executor.shutdown();

        List<Card> cards = new ArrayList<>();
        try {
            for (int i = 0; i < futures.size(); i++) {
                try {
                    cards.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    logger.log(Level.WARNING, "Failed to export card " + trelloCards.get(i).getName(), e.getCause());
                }
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while exporting board " + boardId);
        }
        logger.info("Exported " + cards.size() + " cards.");
        return cards;
    }

    private List<TrelloCard> selectCards(String boardId, List<String> listNames) throws IOException {
        Set<String> listIds = null;
        if (listNames != null && !listNames.isEmpty()) {
            listIds = new HashSet<>();
            Set<String> unknownLists = new HashSet<>(listNames);
            for (TrelloList list : trello.getListsByBoard(boardId)) {
                if (listNames.contains(list.getName())) {
                    listIds.add(list.getId());
                    unknownLists.remove(list.getName());
                }
            }
            if (!unknownLists.isEmpty()) {
                logger.warning("Unknown lists on board " + boardId + ": " + unknownLists);
            }
        }

        List<TrelloCard> selected = new ArrayList<>();
        for (TrelloCard card : trello.getCardsByBoard(boardId)) {
            if (card.isClosed()) {
                logger.fine("Skipping closed card: " + card.getName());
            } else if (listIds == null || listIds.contains(card.getIdList())) {
                selected.add(card);
            }
        }
        return selected;
    }
}
