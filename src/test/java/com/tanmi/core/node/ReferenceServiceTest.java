package com.tanmi.core.node;

import com.tanmi.core.error.ErrorCode;
import com.tanmi.core.error.TanmiException;
import com.tanmi.core.model.DocStatus;
import com.tanmi.core.model.NodeKind;
import com.tanmi.support.TanmiFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceServiceTest {

    @TempDir
    Path tempDir;

    private TanmiFixture fx;
    private ReferenceService references;
    private String ws;
    private String node;

    @BeforeEach
    void setUp() {
        fx = new TanmiFixture(tempDir);
        references = fx.references;
        ws = fx.newWorkspace("compiler");
        node = fx.createNode(ws, "root", NodeKind.EXECUTION, "Parser");
    }

    @Test
    void isolateReturnsPreviousValue() {
        assertFalse(references.isolate(ws, node, true));
        assertTrue(references.isolate(ws, node, true));
        assertTrue(fx.store.readGraph(ws).require(node).isIsolate());
        assertTrue(references.isolate(ws, node, false));
    }

    @Test
    void addingFileReferenceKeepsItOutOfNodeReferences() {
        var docs = references.reference(ws, node, "docs/grammar.md", ReferenceAction.ADD, "grammar");

        assertEquals(1, docs.size());
        assertEquals("grammar", docs.get(0).description());
        assertTrue(fx.store.readGraph(ws).require(node).getReferences().isEmpty());
    }

    @Test
    void nodeReferencesAreMirroredIntoMeta() {
        var lexer = fx.createNode(ws, "root", NodeKind.EXECUTION, "Lexer");

        var docs = references.reference(ws, node, lexer, ReferenceAction.ADD, null);

        assertEquals("Node reference: " + lexer, docs.get(0).description());
        assertEquals(List.of(lexer), fx.store.readGraph(ws).require(node).getReferences());

        references.reference(ws, node, lexer, ReferenceAction.REMOVE, null);
        assertTrue(fx.store.readGraph(ws).require(node).getReferences().isEmpty());
        assertTrue(fx.store.readDetail(ws, node).docs().isEmpty());
    }

    @Test
    void duplicateAddFails() {
        references.reference(ws, node, "docs/a.md", ReferenceAction.ADD, null);

        var ex = assertThrows(TanmiException.class,
                () -> references.reference(ws, node, "docs/a.md", ReferenceAction.ADD, null));
        assertEquals(ErrorCode.REFERENCE_EXISTS, ex.getCode());
    }

    @Test
    void missingReferenceFails() {
        for (ReferenceAction action : List.of(ReferenceAction.REMOVE, ReferenceAction.EXPIRE, ReferenceAction.ACTIVATE)) {
            var ex = assertThrows(TanmiException.class,
                    () -> references.reference(ws, node, "docs/none.md", action, null));
            assertEquals(ErrorCode.REFERENCE_NOT_FOUND, ex.getCode());
        }
    }

    @Test
    void expireAndActivateToggleStatus() {
        references.reference(ws, node, "docs/a.md", ReferenceAction.ADD, null);

        var expired = references.reference(ws, node, "docs/a.md", ReferenceAction.EXPIRE, null);
        assertEquals(DocStatus.EXPIRED, expired.get(0).status());

        var active = references.reference(ws, node, "docs/a.md", ReferenceAction.ACTIVATE, null);
        assertEquals(DocStatus.ACTIVE, active.get(0).status());
    }

    @Test
    void unknownMemoCannotBeAdded() {
        var ex = assertThrows(TanmiException.class,
                () -> references.reference(ws, node, "memo://nope", ReferenceAction.ADD, null));

        assertEquals(ErrorCode.MEMO_NOT_FOUND, ex.getCode());
    }

    @Test
    void blankTargetIsRejected() {
        var ex = assertThrows(TanmiException.class,
                () -> references.reference(ws, node, " ", ReferenceAction.ADD, null));

        assertEquals(ErrorCode.INVALID_PARAMS, ex.getCode());
    }
}
