package tech.compendium.sdk.store;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.compendium.sdk.client.CompendiumClient;
import tech.compendium.sdk.client.DeckQueryApi;
import tech.compendium.sdk.dto.Deck;
import tech.compendium.sdk.support.ErrorMessages;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Client-side cache of decks with the same optimistic delete as {@link JobStore}.
 */
@ApplicationScoped
public class DeckStore {

    private static final Logger LOG = Logger.getLogger(DeckStore.class);

    private final DeckQueryApi api;

    private final List<Deck> decks = new ArrayList<>();
    private boolean loading;
    private String error;

    @Inject
    public DeckStore(CompendiumClient client) {
        this(client.decks());
    }

    public DeckStore(DeckQueryApi api) {
        this.api = api;
    }

    public CompletableFuture<Boolean> fetchDecks() {
        synchronized (this) {
            loading = true;
            error = null;
        }
        return call(api::listDecks).handle((listing, failure) -> {
            synchronized (this) {
                loading = false;
                if (failure != null) {
                    error = ErrorMessages.extract(failure, "Failed to fetch decks");
                    LOG.warnf("Error fetching decks: %s", error);
                    return false;
                }
                decks.clear();
                // A 2xx with an empty body is an empty listing
                if (listing != null) {
                    decks.addAll(listing);
                }
                return true;
            }
        });
    }

    public CompletableFuture<Boolean> deleteDeck(String id) {
        removeLocally(Set.of(id));
        return reconcile(call(() -> api.deleteDeck(id)), "Failed to delete deck");
    }

    public CompletableFuture<Boolean> deleteDecks(Collection<String> ids) {
        Set<String> toDelete = Set.copyOf(ids);
        removeLocally(toDelete);
        return reconcile(call(() -> api.deleteDecks(ids)), "Failed to delete decks");
    }

    private synchronized void removeLocally(Set<String> ids) {
        decks.removeIf(deck -> ids.contains(deck.id()));
    }

    private CompletableFuture<Boolean> reconcile(CompletableFuture<Void> remote, String fallback) {
        return remote.handle((ignored, failure) -> {
            if (failure == null) {
                return CompletableFuture.completedFuture(true);
            }
            String message = ErrorMessages.extract(failure, fallback);
            LOG.warnf("%s, reloading decks: %s", fallback, message);
            return fetchDecks().thenApply(reloaded -> {
                synchronized (this) {
                    error = message;
                }
                return false;
            });
        }).thenCompose(result -> result);
    }

    private static <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> request) {
        try {
            return request.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public synchronized List<Deck> decks() {
        return List.copyOf(decks);
    }

    public synchronized Optional<Deck> findById(String id) {
        return decks.stream().filter(deck -> deck.id().equals(id)).findFirst();
    }

    public synchronized int totalCards() {
        return decks.stream().mapToInt(Deck::cardCount).sum();
    }

    public synchronized boolean isLoading() {
        return loading;
    }

    public synchronized Optional<String> error() {
        return Optional.ofNullable(error);
    }

    public synchronized void clearError() {
        error = null;
    }

    public synchronized void reset() {
        decks.clear();
        loading = false;
        error = null;
    }
}
