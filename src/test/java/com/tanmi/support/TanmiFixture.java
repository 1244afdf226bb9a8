package com.tanmi.support;

import com.tanmi.core.context.ContextService;
import com.tanmi.core.events.EventBus;
import com.tanmi.core.git.GitCapability;
import com.tanmi.core.log.LogService;
import com.tanmi.core.memo.MemoService;
import com.tanmi.core.metrics.TanmiMetrics;
import com.tanmi.core.model.NodeKind;
import com.tanmi.core.model.TransitionAction;
import com.tanmi.core.node.NodeService;
import com.tanmi.core.node.ReferenceService;
import com.tanmi.core.persistence.JsonFileWorkspaceStore;
import com.tanmi.core.state.StateService;
import com.tanmi.core.workspace.WorkspaceLocks;
import com.tanmi.core.workspace.WorkspaceService;
import com.tanmi.dispatch.DispatchBranches;
import com.tanmi.dispatch.DispatchProperties;
import com.tanmi.dispatch.DispatchService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Wires the services by hand over a JSON store in a temporary directory.
 */
public class TanmiFixture {

    public final Path home;
    public final Path projectRoot;
    public final JsonFileWorkspaceStore store;
    public final WorkspaceLocks locks = new WorkspaceLocks();
    public final EventBus eventBus = new EventBus();
    public final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    public final TanmiMetrics metrics = new TanmiMetrics(registry);
    public final DispatchProperties dispatchProperties = new DispatchProperties();
    public final GitCapability git;
    public final DispatchBranches branches;
    public final WorkspaceService workspaces;
    public final NodeService nodes;
    public final StateService states;
    public final ReferenceService references;
    public final ContextService contexts;
    public final MemoService memos;
    public final LogService logs;
    public final DispatchService dispatch;

    public TanmiFixture(Path tempDir) {
        this(tempDir, new InMemoryGitCapability());
    }

    public TanmiFixture(Path tempDir, GitCapability git) {
        this.home = tempDir.resolve("home");
        this.projectRoot = createDirectory(tempDir.resolve("project"));
        this.git = git;
        this.store = new JsonFileWorkspaceStore(home, ".tanmi-workspace", JsonFileWorkspaceStore.createObjectMapper());
        this.branches = new DispatchBranches(git, dispatchProperties);
        this.workspaces = new WorkspaceService(store, locks, branches, eventBus);
        this.nodes = new NodeService(store, locks, workspaces, eventBus, metrics);
        this.states = new StateService(store, locks, workspaces, eventBus, metrics);
        this.references = new ReferenceService(store, locks, workspaces, eventBus);
        this.contexts = new ContextService(store, locks, workspaces, eventBus);
        this.memos = new MemoService(store, locks, workspaces);
        this.logs = new LogService(store, locks, workspaces);
        this.dispatch = new DispatchService(store, locks, workspaces, states, git, branches,
                dispatchProperties, eventBus, metrics);
    }

    /** Creates a workspace on {@link #projectRoot} and returns its id. */
    public String newWorkspace(String name) {
        return workspaces.init(name, projectRoot.toString(), "Ship " + name, List.of(), List.of()).workspaceId();
    }

    public String createNode(String workspaceId, String parentId, NodeKind type, String title) {
        return nodes.create(workspaceId, parentId, type, title, "", List.of()).nodeId();
    }

    /** Creates an execution node under {@code parentId} and starts it. */
    public String startedExecution(String workspaceId, String parentId, String title) {
        var id = createNode(workspaceId, parentId, NodeKind.EXECUTION, title);
        states.transition(workspaceId, id, TransitionAction.START, null, null);
        return id;
    }

    public static Path createDirectory(Path dir) {
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
