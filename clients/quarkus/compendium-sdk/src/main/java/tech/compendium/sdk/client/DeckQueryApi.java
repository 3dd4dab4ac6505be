package tech.compendium.sdk.client;

import tech.compendium.sdk.dto.Deck;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface DeckQueryApi {

    CompletableFuture<List<Deck>> listDecks();

    CompletableFuture<Void> deleteDeck(String id);

    CompletableFuture<Void> deleteDecks(Collection<String> ids);
}
