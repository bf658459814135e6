package com.knowledgeinbox.store;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface ItemStore {
    Item create(ItemDraft draft) throws IOException;

    Optional<Item> get(long id) throws IOException;

    // newest first; a null filter keeps every kind
    List<Item> list(SourceKind filter) throws IOException;

    boolean delete(long id) throws IOException;
}
