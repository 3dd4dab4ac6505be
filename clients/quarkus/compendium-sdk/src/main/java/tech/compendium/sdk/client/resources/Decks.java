package tech.compendium.sdk.client.resources;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import tech.compendium.sdk.client.CompendiumClient;
import tech.compendium.sdk.client.DeckQueryApi;
import tech.compendium.sdk.dto.Deck;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Resource for listing and deleting decks.
 */
public class Decks implements DeckQueryApi {

    private final CompendiumClient client;

    public Decks(CompendiumClient client) {
        this.client = client;
    }

    @Override
    public CompletableFuture<List<Deck>> listDecks() {
        return client.request("GET", "/decks", null, new TypeReference<List<Deck>>() {})
            .thenApply(decks -> decks != null ? decks : List.of());
    }

    @Override
    public CompletableFuture<Void> deleteDeck(String id) {
        return client.requestVoid("DELETE", "/decks/" + id, null);
    }

    @Override
    public CompletableFuture<Void> deleteDecks(Collection<String> ids) {
        return client.requestVoid("POST", "/decks/bulk-delete", new BulkDeleteDecksRequest(List.copyOf(ids)));
    }

    public record BulkDeleteDecksRequest(
        @JsonProperty("deck_ids") List<String> deckIds
    ) {}
}
