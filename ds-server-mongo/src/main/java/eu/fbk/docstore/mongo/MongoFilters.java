package eu.fbk.docstore.mongo;

import java.util.List;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.collect.Lists;

import org.bson.Document;
import org.bson.conversions.Bson;

import com.mongodb.client.model.Filters;

import eu.fbk.docstore.backend.DocumentFilter;
import eu.fbk.docstore.backend.DocumentOrdering;
import eu.fbk.docstore.backend.DocumentQuery.Sort;

/**
 * Conversion of backend-neutral {@link DocumentFilter}s and sorts into MongoDB query documents.
 */
final class MongoFilters {

    // $type aliases indexed by DocumentOrdering rank
    private static final String[] TYPE_ALIASES = { null, "null", "number", "string", "object",
            "binData", "bool", "date" };

    private MongoFilters() {
    }

    static Bson toBson(final DocumentFilter filter) {
        final String field = filter.getField();
        switch (filter.getKind()) {
        case ALL:
            return new Document();
        case AND:
            return Filters.and(toBson(filter.getChildren()));
        case OR:
            return Filters.or(toBson(filter.getChildren()));
        case NOT:
            return Filters.nor(toBson(filter.getChildren().get(0)));
        case EQ:
            return Filters.eq(field, filter.getValue());
        case NE:
            return Filters.ne(field, filter.getValue());
        case LT:
            return Filters.lt(field, filter.getValue());
        case LTE:
            return Filters.lte(field, filter.getValue());
        case GT:
            return Filters.gt(field, filter.getValue());
        case GTE:
            return Filters.gte(field, filter.getValue());
        case IN:
            return Filters.in(field, filter.getValues());
        case EXISTS:
            return Filters.exists(field, Boolean.TRUE.equals(filter.getValue()));
        case PREFIX:
            return prefix(field, (String) filter.getValue());
        case AFTER:
            return after(field, filter.getValue());
        case BEFORE:
            return before(field, filter.getValue());
        default:
            throw new IllegalArgumentException("Unsupported filter " + filter);
        }
    }

    static Bson toBson(final List<Sort> sorts) {
        final Document document = new Document();
        for (final Sort sort : sorts) {
            document.append(sort.getField(), sort.isAscending() ? 1 : -1);
        }
        return document;
    }

    private static List<Bson> toBson(final Iterable<DocumentFilter> filters) {
        final List<Bson> result = Lists.newArrayList();
        for (final DocumentFilter filter : filters) {
            result.add(toBson(filter));
        }
        return result;
    }

    private static Bson prefix(final String field, final String prefix) {
        if (prefix.isEmpty()) {
            return Filters.type(field, TYPE_ALIASES[DocumentOrdering.RANK_STRING]);
        }
        final char last = prefix.charAt(prefix.length() - 1);
        if (last == Character.MAX_VALUE || Character.isSurrogate(last)) {
            return Filters.regex(field, "^" + Pattern.quote(prefix));
        }
        final String upper = prefix.substring(0, prefix.length() - 1) + (char) (last + 1);
        return Filters.and(Filters.gte(field, prefix), Filters.lt(field, upper));
    }

    // values sorting after the operand: same type and greater, or a later type
    private static Bson after(final String field, @Nullable final Object operand) {
        final int rank = DocumentOrdering.rank(operand);
        final List<Bson> disjuncts = Lists.newArrayList();
        if (operand != null) {
            disjuncts.add(Filters.gt(field, operand));
        }
        for (int r = rank + 1; r <= DocumentOrdering.RANK_DATE; ++r) {
            disjuncts.add(Filters.type(field, TYPE_ALIASES[r]));
        }
        return disjuncts.isEmpty() ? Filters.in(field, Lists.newArrayList())
                : disjuncts.size() == 1 ? disjuncts.get(0) : Filters.or(disjuncts);
    }

    // values sorting before the operand: same type and smaller, or an earlier type
    private static Bson before(final String field, @Nullable final Object operand) {
        final int rank = DocumentOrdering.rank(operand);
        final List<Bson> disjuncts = Lists.newArrayList();
        if (operand != null) {
            disjuncts.add(Filters.lt(field, operand));
        }
        for (int r = DocumentOrdering.RANK_NULL; r < rank; ++r) {
            disjuncts.add(Filters.type(field, TYPE_ALIASES[r]));
        }
        return disjuncts.isEmpty() ? Filters.in(field, Lists.newArrayList())
                : disjuncts.size() == 1 ? disjuncts.get(0) : Filters.or(disjuncts);
    }

}
