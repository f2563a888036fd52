package org.pxukit.obs;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.pxukit.provider.ContentProblem;
import org.pxukit.provider.Provider;
import org.pxukit.qualifier.SelectionList;
import org.pxukit.unit.Unit;

/**
 * Serializes the load state of a provider into deterministic BSON/JSON snapshot payloads.
 */
public final class ContentSnapshotDumper {

    public BsonDocument dumpDocument(final Provider provider) {
        Objects.requireNonNull(provider, "provider");

        final BsonDocument providerDocument = new BsonDocument()
                .append("name", new BsonString(provider.name()))
                .append("namespace", new BsonString(provider.namespace()))
                .append("version", new BsonString(provider.version()))
                .append("secure", BsonBoolean.valueOf(provider.isSecure()));

        final List<Unit> units = provider.unitList();
        final BsonArray encodedUnits = new BsonArray(units.size());
        for (final Unit unit : units) {
            encodedUnits.add(toDocument(unit));
        }

        final BsonArray encodedLists = new BsonArray();
        for (final SelectionList list : provider.selectionLists()) {
            encodedLists.add(new BsonDocument()
                    .append("name", new BsonString(String.valueOf(list.name())))
                    .append("origin", new BsonString(list.origin().toString()))
                    .append("patterns", new BsonInt32(list.patternTexts().size())));
        }

        final BsonArray encodedProblems = new BsonArray();
        for (final ContentProblem problem : provider.problemList()) {
            encodedProblems.add(new BsonDocument()
                    .append("path", new BsonString(problem.path().toString()))
                    .append("kind", new BsonString(problem.kind().name()))
                    .append("message", new BsonString(problem.message())));
        }

        return new BsonDocument()
                .append("provider", providerDocument)
                .append("loaded", BsonBoolean.valueOf(provider.isLoaded()))
                .append("units", encodedUnits)
                .append("idMap", counts(provider.idMap()))
                .append("pathMap", counts(provider.pathMap()))
                .append("selectionLists", encodedLists)
                .append("problems", encodedProblems);
    }

    public String dumpJson(final Provider provider) {
        return dumpDocument(provider).toJson();
    }

    private static BsonDocument toDocument(final Unit unit) {
        final BsonDocument encoded = new BsonDocument()
                .append("kind", new BsonString(unit.kind().unitName()))
                .append("origin", new BsonString(unit.origin().toString()))
                .append("virtual", BsonBoolean.valueOf(unit.isVirtual()));
        unit.id().ifPresent(id -> encoded.append("id", new BsonString(id)));
        unit.path().ifPresent(path -> encoded.append("path", new BsonString(path)));
        return encoded;
    }

    private static BsonDocument counts(final Map<String, List<Unit>> index) {
        final BsonDocument encoded = new BsonDocument();
        for (final Map.Entry<String, List<Unit>> entry : index.entrySet()) {
            encoded.append(entry.getKey(), new BsonInt32(entry.getValue().size()));
        }
        return encoded;
    }
}
