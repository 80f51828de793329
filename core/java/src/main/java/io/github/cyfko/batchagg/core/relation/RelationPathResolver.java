package io.github.cyfko.batchagg.core.relation;

import io.github.cyfko.batchagg.core.exception.RelationResolutionException;
import io.github.cyfko.batchagg.core.model.RelationPath;
import io.github.cyfko.batchagg.core.model.ResolvedRelationPath;
import io.github.cyfko.batchagg.core.spi.RelationRegistry;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Translates a {@link RelationPath} into what a grouped query needs: the entity and
 * column to group on, the joins leading to them and whether rows must be deduplicated.
 *
 * <h2>Direct relations</h2>
 * <p>
 * The target carries the foreign key: the query groups on
 * {@code target.<foreignKey>.<ownerId>}, no join, no deduplication.
 * </p>
 *
 * <h2>Through relations</h2>
 * <p>
 * The target is joined to the intermediate entity through the target's own
 * association to it (the <em>connecting association</em>), and the query groups on the
 * intermediate's parent key. A many-to-many join may yield the same target several
 * times for one parent, so the resolution always requires deduplication: COUNT counts
 * distinct targets and EXISTS selects distinct parent keys.
 * </p>
 *
 * <pre>{@code
 * // User.tags through posts, Tag declares "posts"
 * // FROM Tag t JOIN t.posts j WHERE j.user.id IN (:ids) GROUP BY j.user.id
 * ResolvedRelationPath resolved = resolver.resolve(registry.relation(User.class, "tags"));
 * resolved.joinPlan();      // ["posts"]
 * resolved.groupByColumn(); // "user.id"
 * }</pre>
 *
 * <p>
 * Resolutions are derived from static metadata only and are memoized per path.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class RelationPathResolver {

    private static final Logger logger = Logger.getLogger(RelationPathResolver.class.getName());

    private final RelationRegistry registry;
    private final Map<RelationPath, ResolvedRelationPath> resolutions = new ConcurrentHashMap<>();

    public RelationPathResolver(RelationRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    }

    /**
     * Resolves {@code path}.
     *
     * @throws RelationResolutionException if {@code path} is a through relation whose target
     *                                     declares no association to the intermediate entity
     */
    public ResolvedRelationPath resolve(RelationPath path) {
        Objects.requireNonNull(path, "path cannot be null");
        return resolutions.computeIfAbsent(path, this::resolveInternal);
    }

    private ResolvedRelationPath resolveInternal(RelationPath path) {
        String targetId = registry.identifierAttribute(path.targetType());

        if (!path.isThrough()) {
            String ownerId = registry.identifierAttribute(path.ownerType());
            ResolvedRelationPath resolved = new ResolvedRelationPath(
                    path,
                    path.targetType(),
                    path.foreignKey() + "." + ownerId,
                    false,
                    List.of(),
                    targetId);
            logger.fine(() -> String.format("Resolved %s: group by %s.%s",
                    path.qualifiedName(), path.targetType().getSimpleName(), resolved.groupByColumn()));
            return resolved;
        }

        RelationPath.ThroughHop hop = path.through();
        String connecting = registry.findAssociation(path.targetType(), hop.intermediateType())
                .orElseThrow(() -> new RelationResolutionException(String.format(
                        "Could not find association from %s to %s required by relation %s",
                        path.targetType().getSimpleName(),
                        hop.intermediateType().getSimpleName(),
                        path.qualifiedName())));

        ResolvedRelationPath resolved = new ResolvedRelationPath(
                path,
                hop.intermediateType(),
                hop.parentKey(),
                true,
                List.of(connecting),
                targetId);
        logger.fine(() -> String.format("Resolved %s: join %s.%s, group by %s.%s (distinct)",
                path.qualifiedName(), path.targetType().getSimpleName(), connecting,
                hop.intermediateType().getSimpleName(), hop.parentKey()));
        return resolved;
    }
}
