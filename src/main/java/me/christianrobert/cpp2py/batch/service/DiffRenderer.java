package me.christianrobert.cpp2py.batch.service;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders unified diffs between the current content of an output file and freshly
 * generated code.
 */
@ApplicationScoped
public class DiffRenderer {

    private static final int CONTEXT_LINES = 3;

    /**
     * @param original current file content, empty when the file does not exist yet
     * @return unified diff text, empty when both sides are equal
     */
    public String unifiedDiff(String fileName, String original, String revised) {
        List<String> originalLines = original.lines().collect(Collectors.toList());
        List<String> revisedLines = revised.lines().collect(Collectors.toList());
        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + fileName, "b/" + fileName, originalLines, patch, CONTEXT_LINES);
        return String.join("\n", unified) + "\n";
    }
}
