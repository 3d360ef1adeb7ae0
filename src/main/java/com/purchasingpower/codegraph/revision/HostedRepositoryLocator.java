package com.purchasingpower.codegraph.revision;

import com.purchasingpower.codegraph.configuration.AnalysisProperties;
import com.purchasingpower.codegraph.configuration.HostingProperties;
import com.purchasingpower.codegraph.core.CodeSource;
import lombok.RequiredArgsConstructor;
import org.eclipse.jgit.transport.CredentialsProvider;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;
import org.springframework.stereotype.Component;

/**
 * Turns hosted-repository paths into clone URLs and supplies credentials.
 *
 * <p>Examples with base URL {@code https://gitlab.example.com}:
 * <pre>
 *   org/svc                              → https://gitlab.example.com/org/svc.git
 *   https://github.com/org/svc           → https://github.com/org/svc.git
 *   git@gitlab.example.com:org/svc.git   → unchanged
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class HostedRepositoryLocator {

    private final AnalysisProperties properties;

    public String cloneUrl(CodeSource source) {
        String path = source.getPath().trim();

        if (path.startsWith("git@") || path.startsWith("ssh://") || path.startsWith("file:")) {
            return path;
        }
        if (path.startsWith("http://") || path.startsWith("https://")) {
            return withGitSuffix(stripTrailingSlash(path));
        }

        String baseUrl = stripTrailingSlash(properties.getHosting().getBaseUrl());
        String projectPath = path.startsWith("/") ? path.substring(1) : path;
        return withGitSuffix(baseUrl + "/" + stripTrailingSlash(projectPath));
    }

    /**
     * @return credentials for the hosting service, or null for anonymous access
     */
    public CredentialsProvider credentials() {
        HostingProperties hosting = properties.getHosting();
        if (!hosting.hasCredentials()) {
            return null;
        }
        // GitLab accepts any username with a personal access token
        String username = hosting.getUsername() != null && !hosting.getUsername().isBlank()
                ? hosting.getUsername()
                : "oauth2";
        return new UsernamePasswordCredentialsProvider(username, hosting.getToken());
    }

    private static String stripTrailingSlash(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static String withGitSuffix(String url) {
        return url.endsWith(".git") ? url : url + ".git";
    }
}
