package com.tanmi.core.workspace;

import com.tanmi.core.error.ErrorCode;
import com.tanmi.core.error.TanmiException;
import com.tanmi.core.model.NodeKind;
import com.tanmi.core.model.NodeStatus;
import com.tanmi.core.model.WorkspaceStatus;
import com.tanmi.core.workspace.WorkspaceService.RuleAction;
import com.tanmi.support.InMemoryGitCapability;
import com.tanmi.support.TanmiFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceServiceTest {

    @TempDir
    Path tempDir;

    private InMemoryGitCapability git;
    private TanmiFixture fx;
    private WorkspaceService workspaces;

    @BeforeEach
    void setUp() {
        git = new InMemoryGitCapability();
        fx = new TanmiFixture(tempDir, git);
        workspaces = fx.workspaces;
    }

    private static ErrorCode codeOf(Executable call) {
        return assertThrows(TanmiException.class, call).getCode();
    }

    // --- init ---

    @Nested
    @DisplayName("init")
    class Init {

        @Test
        void createsPlanningRootTitledAfterWorkspace() {
            var result = workspaces.init("compiler", fx.projectRoot.toString(), "Ship it",
                    List.of("no globals"), List.of());

            var view = workspaces.get(result.workspaceId());
            var root = view.graph().require(result.rootNodeId());
            assertEquals(NodeKind.PLANNING, root.getType());
            assertEquals(NodeStatus.PENDING, root.getStatus());
            assertEquals("compiler", fx.store.readDetail(result.workspaceId(), root.getId()).title());
            assertEquals("Ship it", view.detail().goal());
            assertEquals(List.of("no globals"), view.detail().rules());
            assertEquals(root.getId(), view.graph().getCurrentFocus());
            assertEquals(WorkspaceStatus.ACTIVE, view.config().getStatus());
        }

        @Test
        void sameNameOnSameRootIsRejected() {
            fx.newWorkspace("compiler");

            assertEquals(ErrorCode.WORKSPACE_EXISTS, codeOf(() -> fx.newWorkspace("compiler")));
        }

        @Test
        void invalidNamesAreRejected() {
            var root = fx.projectRoot.toString();

            assertEquals(ErrorCode.INVALID_NAME, codeOf(() -> workspaces.init(" ", root, "", null, null)));
            assertEquals(ErrorCode.INVALID_NAME, codeOf(() -> workspaces.init("a/b", root, "", null, null)));
        }

        @Test
        void invalidProjectRootsAreRejected() {
            var missing = tempDir.resolve("missing").toString();
            var dotted = fx.projectRoot.resolve("..").resolve("project").toString();

            assertEquals(ErrorCode.INVALID_PATH, codeOf(() -> workspaces.init("x", missing, "", null, null)));
            assertEquals(ErrorCode.INVALID_PATH, codeOf(() -> workspaces.init("x", dotted, "", null, null)));
            assertEquals(ErrorCode.INVALID_PATH, codeOf(() -> workspaces.init("x", "", "", null, null)));
        }
    }

    // --- queries ---

    @Test
    void listFiltersByStatus() {
        var active = fx.newWorkspace("active");
        var archived = fx.newWorkspace("archived");
        workspaces.archive(archived);

        assertEquals(2, workspaces.list(null).size());
        assertEquals(List.of(active), workspaces.list(WorkspaceStatus.ACTIVE).stream().map(c -> c.getId()).toList());
        assertEquals(List.of(archived), workspaces.list(WorkspaceStatus.ARCHIVED).stream().map(c -> c.getId()).toList());
    }

    @Test
    void statusCountsNodesAndRendersTree() {
        var ws = fx.newWorkspace("compiler");
        fx.createNode(ws, "root", NodeKind.EXECUTION, "Lexer");

        var status = workspaces.status(ws);

        assertEquals(2, status.totalNodes());
        assertEquals(2, status.statusCounts().values().stream().mapToInt(Integer::intValue).sum());
        assertFalse(status.dispatchEnabled());
        assertTrue(status.tree().contains("- [P] compiler (root)"));
        assertTrue(status.tree().contains("  - [E] Lexer ("));
    }

    @Test
    void unknownWorkspaceFails() {
        assertEquals(ErrorCode.WORKSPACE_NOT_FOUND, codeOf(() -> workspaces.require("nope")));
        assertEquals(ErrorCode.WORKSPACE_NOT_FOUND, codeOf(() -> workspaces.require("")));
    }

    // --- rules ---

    @Nested
    @DisplayName("updateRules")
    class Rules {

        @Test
        void addIgnoresDuplicatesAndRemoveDrops() {
            var ws = fx.newWorkspace("compiler");

            workspaces.updateRules(ws, RuleAction.ADD, "no globals", null);
            workspaces.updateRules(ws, RuleAction.ADD, "no globals", null);
            assertEquals(List.of("no globals", "tests first"),
                    workspaces.updateRules(ws, RuleAction.ADD, "tests first", null));

            assertEquals(List.of("tests first"), workspaces.updateRules(ws, RuleAction.REMOVE, "no globals", null));
        }

        @Test
        void replaceSwapsTheWholeList() {
            var ws = fx.newWorkspace("compiler");
            workspaces.updateRules(ws, RuleAction.ADD, "old", null);

            var rules = workspaces.updateRules(ws, RuleAction.REPLACE, null, List.of("a", "b"));

            assertEquals(List.of("a", "b"), rules);
            assertEquals(List.of("a", "b"), workspaces.get(ws).detail().rules());
        }

        @Test
        void missingRuleIsRejected() {
            var ws = fx.newWorkspace("compiler");

            assertEquals(ErrorCode.INVALID_PARAMS, codeOf(() -> workspaces.updateRules(ws, RuleAction.ADD, " ", null)));
            assertEquals(ErrorCode.INVALID_PARAMS, codeOf(() -> workspaces.updateRules(ws, RuleAction.REPLACE, null, null)));
        }
    }

    // --- lifecycle ---

    @Nested
    @DisplayName("archive, restore, delete")
    class Lifecycle {

        @Test
        void archivedWorkspaceRejectsMutations() {
            var ws = fx.newWorkspace("compiler");
            workspaces.archive(ws);

            assertEquals(ErrorCode.WORKSPACE_ARCHIVED, codeOf(() -> workspaces.requireActive(ws)));
            assertEquals(ErrorCode.WORKSPACE_ARCHIVED, codeOf(() -> workspaces.updateRules(ws, RuleAction.ADD, "x", null)));
            assertEquals(ErrorCode.WORKSPACE_ARCHIVED, codeOf(() -> workspaces.archive(ws)));
        }

        @Test
        void restoreReactivates() {
            var ws = fx.newWorkspace("compiler");
            assertEquals(ErrorCode.WORKSPACE_ACTIVE, codeOf(() -> workspaces.restore(ws)));

            workspaces.archive(ws);
            workspaces.restore(ws);

            assertEquals(WorkspaceStatus.ACTIVE, workspaces.requireActive(ws).getStatus());
        }

        @Test
        void deletingActiveWorkspaceNeedsForce() {
            var ws = fx.newWorkspace("compiler");

            assertEquals(ErrorCode.WORKSPACE_ACTIVE, codeOf(() -> workspaces.delete(ws, false)));

            workspaces.delete(ws, true);
            assertEquals(ErrorCode.WORKSPACE_NOT_FOUND, codeOf(() -> workspaces.require(ws)));
        }

        @Test
        void archivedWorkspaceDeletesWithoutForce() {
            var ws = fx.newWorkspace("compiler");
            workspaces.archive(ws);

            workspaces.delete(ws, false);

            assertTrue(workspaces.list(null).isEmpty());
        }

        @Test
        void archiveTearsDownGitDispatch() {
            var ws = fx.newWorkspace("compiler");
            var process = fx.dispatch.enable(ws, true).config().getProcessBranch();
            assertTrue(git.hasBranch(process));

            var config = workspaces.archive(ws);

            assertFalse(config.isDispatchEnabled());
            assertFalse(git.hasBranch(process));
            assertEquals("main", git.currentBranch(fx.projectRoot));
        }
    }
}
