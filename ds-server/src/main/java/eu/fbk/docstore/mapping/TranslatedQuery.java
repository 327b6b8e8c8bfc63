package eu.fbk.docstore.mapping;

import java.util.List;

import com.google.common.collect.ImmutableList;

import eu.fbk.docstore.backend.DocumentFilter;
import eu.fbk.docstore.backend.DocumentQuery;
import eu.fbk.docstore.data.Query;
import eu.fbk.docstore.data.Query.Order;

/**
 * The result of translating a {@link Query} for the document backend: the collection to query,
 * the backend {@link DocumentQuery} and the effective sort orders (those of the query followed by
 * the implicit key order), which determine the contents of end cursors.
 */
public final class TranslatedQuery {

    private final Query query;

    private final String collection;

    private final DocumentQuery documentQuery;

    private final List<Order> orders;

    TranslatedQuery(final Query query, final String collection,
            final DocumentQuery documentQuery, final List<Order> orders) {
        this.query = query;
        this.collection = collection;
        this.documentQuery = documentQuery;
        this.orders = ImmutableList.copyOf(orders);
    }

    public Query getQuery() {
        return this.query;
    }

    public String getCollection() {
        return this.collection;
    }

    public DocumentQuery getDocumentQuery() {
        return this.documentQuery;
    }

    public DocumentFilter getFilter() {
        return this.documentQuery.getFilter();
    }

    public List<Order> getOrders() {
        return this.orders;
    }

    @Override
    public String toString() {
        return this.collection + ": " + this.documentQuery;
    }

}
