package com.tanmi.core.memo;

import com.tanmi.core.error.ErrorCode;
import com.tanmi.core.error.TanmiException;
import com.tanmi.core.model.Memo;
import com.tanmi.core.persistence.WorkspaceStore;
import com.tanmi.core.workspace.Ids;
import com.tanmi.core.workspace.WorkspaceLocks;
import com.tanmi.core.workspace.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Workspace memos: standalone notes any node can pull into its context via {@code memo://<id>}.
 */
@Service
public class MemoService {

    private static final Logger log = LoggerFactory.getLogger(MemoService.class);

    private final WorkspaceStore store;
    private final WorkspaceLocks locks;
    private final WorkspaceService workspaces;

    public MemoService(WorkspaceStore store, WorkspaceLocks locks, WorkspaceService workspaces) {
        this.store = store;
        this.locks = locks;
        this.workspaces = workspaces;
    }

    /**
     * @param memos   matching memos, most recently updated first
     * @param allTags every tag in use in the workspace, sorted
     */
    public record MemoList(List<Memo> memos, List<String> allTags) {}

    public Memo create(String workspaceId, String title, String summary, String content, List<String> tags) {
        if (title == null || title.isBlank()) {
            throw new TanmiException(ErrorCode.INVALID_PARAMS, "Memo title must not be blank");
        }
        return locks.withLock(workspaceId, () -> {
            workspaces.requireActive(workspaceId);
            var now = Instant.now();
            var memo = new Memo(Ids.memoId(), title, summary, tags, content, now, now);
            store.writeMemo(workspaceId, memo);
            log.info("Created memo {} in workspace {}", memo.id(), workspaceId);
            return memo;
        });
    }

    /**
     * Lists memos, keeping those carrying any of {@code tags} when a filter is given.
     */
    public MemoList list(String workspaceId, Collection<String> tags) {
        workspaces.require(workspaceId);
        var all = store.listMemos(workspaceId);

        var allTags = new TreeSet<String>();
        all.forEach(memo -> allTags.addAll(memo.tags()));

        var matching = all.stream()
                .filter(memo -> tags == null || tags.isEmpty() || memo.tags().stream().anyMatch(tags::contains))
                .sorted(Comparator.comparing(Memo::updatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
        return new MemoList(matching, List.copyOf(allTags));
    }

    public Memo get(String workspaceId, String memoId) {
        workspaces.require(workspaceId);
        return store.findMemo(workspaceId, stripPrefix(memoId)).orElseThrow(() -> notFound(memoId));
    }

    /**
     * Replaces the given fields; null leaves a field unchanged.
     */
    public Memo update(String workspaceId, String memoId, String title, String summary, String content,
                       List<String> tags) {
        return locks.withLock(workspaceId, () -> {
            workspaces.requireActive(workspaceId);
            var id = stripPrefix(memoId);
            var existing = store.findMemo(workspaceId, id).orElseThrow(() -> notFound(memoId));
            var updated = new Memo(id,
                    title != null ? title : existing.title(),
                    summary != null ? summary : existing.summary(),
                    tags != null ? tags : existing.tags(),
                    content != null ? content : existing.content(),
                    existing.createdAt(),
                    Instant.now());
            store.writeMemo(workspaceId, updated);
            return updated;
        });
    }

    /**
     * Deletes a memo. References to it stay on nodes and are skipped when context is composed.
     */
    public void delete(String workspaceId, String memoId) {
        locks.run(workspaceId, () -> {
            workspaces.requireActive(workspaceId);
            var id = stripPrefix(memoId);
            if (store.findMemo(workspaceId, id).isEmpty()) {
                throw notFound(memoId);
            }
            store.deleteMemo(workspaceId, id);
            log.info("Deleted memo {} in workspace {}", id, workspaceId);
        });
    }

    private static String stripPrefix(String memoId) {
        return Memo.isReference(memoId) ? Memo.idFromReference(memoId) : memoId;
    }

    private static TanmiException notFound(String memoId) {
        return new TanmiException(ErrorCode.MEMO_NOT_FOUND, "Memo '%s' not found".formatted(memoId));
    }
}
