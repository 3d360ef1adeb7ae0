package com.purchasingpower.codegraph.revision.impl;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.purchasingpower.codegraph.core.CodeSource;
import com.purchasingpower.codegraph.exception.RevisionUnavailableException;
import com.purchasingpower.codegraph.revision.HostedRepositoryLocator;
import com.purchasingpower.codegraph.revision.RevisionResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.LsRemoteCommand;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.errors.RepositoryNotFoundException;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Ref;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves revisions with JGit.
 *
 * <ul>
 *   <li>Hosted repositories: {@code ls-remote} of the configured branch, no clone needed.</li>
 *   <li>Local git working trees: HEAD commit.</li>
 *   <li>Plain local directories: content fingerprint {@code fs-<sha256>} over
 *       relative path, size and modification time of every file.</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GitRevisionResolver implements RevisionResolver {

    static final String FINGERPRINT_PREFIX = "fs-";

    private final HostedRepositoryLocator locator;

    @Override
    public String currentRevision(CodeSource source) {
        return switch (source.getSourceType()) {
            case HOSTED_REPOSITORY -> resolveRemoteHead(source);
            case LOCAL_FILESYSTEM -> resolveLocal(source);
        };
    }

    private String resolveRemoteHead(CodeSource source) {
        String url = locator.cloneUrl(source);
        String branchRef = "refs/heads/" + source.getEffectiveBranch();

        try {
            LsRemoteCommand command = Git.lsRemoteRepository()
                    .setRemote(url)
                    .setHeads(true);
            if (locator.credentials() != null) {
                command.setCredentialsProvider(locator.credentials());
            }

            Map<String, Ref> refs = command.callAsMap();
            Ref ref = refs.get(branchRef);
            if (ref == null || ref.getObjectId() == null) {
                throw new RevisionUnavailableException(source.getSourceId(),
                        "Branch '" + source.getEffectiveBranch() + "' not found in " + url);
            }

            String revision = ref.getObjectId().getName();
            log.debug("Resolved {} {} -> {}", url, branchRef, revision);
            return revision;

        } catch (RevisionUnavailableException e) {
            throw e;
        } catch (GitAPIException | RuntimeException e) {
            log.warn("Failed to resolve revision for {}: {}", url, e.getMessage());
            throw new RevisionUnavailableException(source.getSourceId(),
                    "Hosting service unavailable for " + url + ": " + e.getMessage(), e);
        }
    }

    private String resolveLocal(CodeSource source) {
        Path root = Paths.get(source.getPath());
        if (!Files.isDirectory(root)) {
            throw new RevisionUnavailableException(source.getSourceId(),
                    "Local path does not exist or is not a directory: " + root);
        }

        if (Files.isDirectory(root.resolve(".git"))) {
            return resolveLocalHead(source, root);
        }
        return fingerprint(source, root);
    }

    private String resolveLocalHead(CodeSource source, Path root) {
        try (Git git = Git.open(root.toFile())) {
            ObjectId head = git.getRepository().resolve("HEAD");
            if (head == null) {
                throw new RevisionUnavailableException(source.getSourceId(),
                        "No HEAD commit found in " + root);
            }
            return head.getName();
        } catch (RepositoryNotFoundException e) {
            return fingerprint(source, root);
        } catch (IOException e) {
            throw new RevisionUnavailableException(source.getSourceId(),
                    "Failed to read git HEAD in " + root + ": " + e.getMessage(), e);
        }
    }

    private String fingerprint(CodeSource source, Path root) {
        try (Stream<Path> files = Files.walk(root)) {
            List<Path> ordered = files
                    .filter(Files::isRegularFile)
                    .filter(p -> !isHidden(root.relativize(p)))
                    .sorted(Comparator.comparing(p -> root.relativize(p).toString()))
                    .collect(Collectors.toList());

            Hasher hasher = Hashing.sha256().newHasher();
            for (Path file : ordered) {
                BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
                hasher.putString(root.relativize(file).toString().replace('\\', '/'), StandardCharsets.UTF_8)
                        .putLong(attributes.size())
                        .putLong(attributes.lastModifiedTime().toMillis());
            }
            return FINGERPRINT_PREFIX + hasher.hash().toString().substring(0, 40);

        } catch (IOException | UncheckedIOException e) {
            throw new RevisionUnavailableException(source.getSourceId(),
                    "Failed to fingerprint " + root + ": " + e.getMessage(), e);
        }
    }

    private static boolean isHidden(Path relative) {
        for (Path segment : relative) {
            if (segment.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
