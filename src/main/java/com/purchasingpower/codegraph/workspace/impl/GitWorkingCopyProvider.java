package com.purchasingpower.codegraph.workspace.impl;

import com.purchasingpower.codegraph.configuration.AnalysisProperties;
import com.purchasingpower.codegraph.core.CodeSource;
import com.purchasingpower.codegraph.exception.WorkingCopyException;
import com.purchasingpower.codegraph.revision.HostedRepositoryLocator;
import com.purchasingpower.codegraph.workspace.WorkingCopyProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.CloneCommand;
import org.eclipse.jgit.api.FetchCommand;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.ResetCommand;
import org.eclipse.jgit.transport.CredentialsProvider;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * JGit-backed working copies.
 *
 * <p>Hosted repositories live under {@code <workspace-dir>/<tenant>/<sourceId>}
 * and are cloned once, then fetched and hard-reset to the requested revision.
 * Local sources are used in place.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GitWorkingCopyProvider implements WorkingCopyProvider {

    private final AnalysisProperties properties;
    private final HostedRepositoryLocator locator;

    @Override
    public Path materialize(CodeSource source, String revision) {
        return switch (source.getSourceType()) {
            case HOSTED_REPOSITORY -> checkoutHosted(source, revision);
            case LOCAL_FILESYSTEM -> localPath(source);
        };
    }

    private Path localPath(CodeSource source) {
        Path root = Paths.get(source.getPath());
        if (!Files.isDirectory(root)) {
            throw new WorkingCopyException("Local path does not exist: " + root);
        }
        return root;
    }

    private Path checkoutHosted(CodeSource source, String revision) {
        File destination = Paths.get(properties.getWorkspaceDir(), source.getTenant(), source.getSourceId()).toFile();
        String url = locator.cloneUrl(source);
        CredentialsProvider credentials = locator.credentials();

        if (!isValidGitRepository(destination)) {
            cloneInto(url, source.getEffectiveBranch(), destination, credentials);
        } else {
            fetch(destination, credentials);
        }

        try (Git git = Git.open(destination)) {
            git.reset()
                    .setMode(ResetCommand.ResetType.HARD)
                    .setRef(revision)
                    .call();
            log.info("Checked out {} at {}", source.getSourceId(), revision);
            return destination.toPath();

        } catch (Exception e) {
            throw new WorkingCopyException("Checkout of " + revision + " failed for " + url + ": " + e.getMessage(), e);
        }
    }

    private void cloneInto(String url, String branch, File destination, CredentialsProvider credentials) {
        // Ensure clean state
        if (destination.exists()) {
            FileSystemUtils.deleteRecursively(destination);
        }
        destination.mkdirs();

        log.info("Cloning {} into {}", url, destination);
        CloneCommand clone = Git.cloneRepository()
                .setURI(url)
                .setBranch(branch)
                .setDirectory(destination);
        if (credentials != null) {
            clone.setCredentialsProvider(credentials);
        }

        try (Git ignored = clone.call()) {
            log.debug("Clone of {} complete", url);
        } catch (Exception e) {
            log.error("Git clone failed. Cleaning up workspace {}", destination);
            FileSystemUtils.deleteRecursively(destination);
            throw new WorkingCopyException("Git clone failed for " + url + ": " + e.getMessage(), e);
        }
    }

    private void fetch(File destination, CredentialsProvider credentials) {
        try (Git git = Git.open(destination)) {
            FetchCommand fetch = git.fetch().setRemote("origin");
            if (credentials != null) {
                fetch.setCredentialsProvider(credentials);
            }
            fetch.call();
        } catch (Exception e) {
            throw new WorkingCopyException("Git fetch failed in " + destination + ": " + e.getMessage(), e);
        }
    }

    private boolean isValidGitRepository(File workspaceDir) {
        if (workspaceDir == null || !workspaceDir.exists() || !workspaceDir.isDirectory()) {
            return false;
        }
        File gitDir = new File(workspaceDir, ".git");
        return gitDir.exists() && gitDir.isDirectory();
    }
}
