// file: server/src/main/java/io/fset/server/ProjectService.java
package io.fset.server;

import io.fset.core.ProjectDefaults;
import io.fset.core.WireFormat;
import io.fset.core.diff.Diff;
import io.fset.core.model.NewProject;
import io.fset.core.model.Project;
import io.fset.server.reconcile.DiffReconciler;
import io.fset.server.reconcile.DiffResult;
import io.fset.storage.ProjectRepository;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Application service for projects.
 *
 * Responsibilities:
 *  - Hide storage details (JDBC, transactions) from the HTTP layer.
 *  - Fill provisioning defaults (anchor, key) on create.
 *  - Load the target project and hand diffs to the {@link DiffReconciler}.
 *  - Produce the wire representation clients diff against.
 *
 * A missing project is reported as an empty Optional, never as an exception.
 */
public class ProjectService {

    private final ProjectRepository repository;
    private final DiffReconciler reconciler;
    private final ProjectDefaults defaults;

    public ProjectService(ProjectRepository repository, ProjectDefaults defaults) {
        this(repository, new DiffReconciler(repository, defaults), defaults);
    }

    public ProjectService(ProjectRepository repository, DiffReconciler reconciler, ProjectDefaults defaults) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    /** Project by anchor (UUID-shaped names) or by key. */
    public Optional<Project> get(String name) {
        Objects.requireNonNull(name, "name");
        return repository.findByName(name);
    }

    /**
     * Provision a project. A missing anchor is minted; a missing or blank key
     * becomes {@code project_<unix seconds>}.
     */
    public Project create(NewProject attrs) {
        NewProject p = attrs == null ? NewProject.empty() : attrs;
        if (p.anchor() == null || p.anchor().isBlank()) {
            p = p.withAnchor(defaults.newAnchor());
        }
        if (p.key() == null || p.key().isBlank()) {
            p = p.withKey(defaults.defaultKey());
        }
        return repository.create(p, defaults.timestamp());
    }

    /** Apply a raw diff to an already loaded project. */
    public DiffResult persistDiff(Map<String, Object> rawDiff, Project project) {
        return reconciler.persist(Diff.of(rawDiff), project);
    }

    /**
     * Load the named project and apply a raw diff to it.
     *
     * @return empty if no such project exists
     */
    public Optional<DiffResult> persistDiff(String name, Map<String, Object> rawDiff) {
        return get(name).map(project -> persistDiff(rawDiff, project));
    }

    public Map<String, Object> wire(Project project) {
        return WireFormat.toWire(project);
    }
}
