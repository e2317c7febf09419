package com.williamcallahan.movie_discovery_engine.service.preference;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.williamcallahan.movie_discovery_engine.model.SwipeSignal;
import com.williamcallahan.movie_discovery_engine.util.JsonFileStore;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Persists the retained swipe signal window as JSON.
 * Only signals are stored; the preference profile is always rebuilt from them.
 */
@Slf4j
public class SignalJournal {

    private final JsonFileStore<Document> store;

    public SignalJournal(JsonFileStore<Document> store) {
        this.store = store;
    }

    /**
     * @return stored signals in record order, empty when the journal is missing or corrupt
     */
    public List<SwipeSignal> load() {
        List<SwipeSignal> signals = store.read()
            .map(Document::getSignals)
            .orElseGet(List::of)
            .stream()
            .filter(Objects::nonNull)
            .toList();
        log.debug("Loaded {} swipe signal(s) from {}", signals.size(), store.getFile());
        return signals;
    }

    public boolean save(List<SwipeSignal> signals) {
        Document document = new Document();
        document.setSignals(new ArrayList<>(signals));
        return store.write(document);
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Document {
        private int version = 1;
        private List<SwipeSignal> signals = new ArrayList<>();
    }
}
