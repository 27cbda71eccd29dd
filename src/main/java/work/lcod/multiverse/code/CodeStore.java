package work.lcod.multiverse.code;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Collectors;
import work.lcod.multiverse.lang.Node;

/**
 * Append-only, ordered list of analysis steps. Steps are kept unevaluated.
 */
public final class CodeStore {
    private final List<CodeStep> steps = new ArrayList<>();
    private String contentHash = hash(List.of());

    public synchronized CodeStep append(String source, List<Node> statements) {
        var step = new CodeStep(steps.size(), source, statements);
        steps.add(step);
        contentHash = hash(steps);
        return step;
    }

    public synchronized List<CodeStep> steps() {
        return List.copyOf(steps);
    }

    public synchronized int size() {
        return steps.size();
    }

    /**
     * SHA-256 over the concatenated step sources; identifies the code a cached result was produced from.
     */
    public synchronized String contentHash() {
        return contentHash;
    }

    public synchronized String text() {
        return steps.stream().map(CodeStep::source).collect(Collectors.joining("\n"));
    }

    private static String hash(List<CodeStep> steps) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            for (var step : steps) {
                digest.update(step.source().getBytes(StandardCharsets.UTF_8));
                digest.update((byte) 0);
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }
}
