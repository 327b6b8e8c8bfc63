package eu.fbk.docstore.data;

import java.util.Iterator;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

/**
 * A page of query results, with the cursor to resume after it.
 */
public final class QueryResult implements Iterable<Entity> {

    private final List<Entity> entities;

    @Nullable
    private final Cursor endCursor;

    private final boolean more;

    public QueryResult(final List<Entity> entities, @Nullable final Cursor endCursor,
            final boolean more) {
        this.entities = ImmutableList.copyOf(entities);
        this.endCursor = endCursor;
        this.more = more;
    }

    public List<Entity> getEntities() {
        return this.entities;
    }

    /**
     * Returns the cursor pointing after the last entity of this page.
     *
     * @return the end cursor, or null if the page is empty
     */
    @Nullable
    public Cursor getEndCursor() {
        return this.endCursor;
    }

    /**
     * Returns whether further results exist after this page.
     *
     * @return true if the query has more results
     */
    public boolean hasMore() {
        return this.more;
    }

    public int size() {
        return this.entities.size();
    }

    @Override
    public Iterator<Entity> iterator() {
        return this.entities.iterator();
    }

    @Override
    public String toString() {
        return this.entities.size() + " entities" + (this.more ? ", more" : "");
    }

}
