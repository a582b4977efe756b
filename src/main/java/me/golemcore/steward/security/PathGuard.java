package me.golemcore.steward.security;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.steward.domain.model.StewardException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validates identifiers and filesystem locations supplied by agents.
 *
 * <p>
 * Lexical checks ({@link #requireSessionId}, {@link #requireTargetName}) never
 * touch the disk, so a hostile value is rejected before any path is built
 * from it.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class PathGuard {

    private static final Pattern SESSION_ID = Pattern.compile("[A-Za-z0-9-]{1,64}");
    private static final Pattern TARGET_NAME = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    public String requireSessionId(String sessionId) {
        if (sessionId == null || !SESSION_ID.matcher(sessionId).matches()) {
            log.warn("[Security] Rejected session id: {}", sessionId);
            throw StewardException.security("Invalid session id: " + sessionId);
        }
        return sessionId;
    }

    /**
     * Check a context target name such as {@code PROJECT-CONTEXT}.
     */
    public String requireTargetName(String target) {
        if (target == null || target.isBlank()) {
            throw StewardException.validation("Target is required");
        }
        if (target.contains("..") || target.contains("/") || target.contains("\\")) {
            log.warn("[Security] Path traversal in target: {}", target);
            throw StewardException.security("Path traversal in target: " + target);
        }
        if (!TARGET_NAME.matcher(target).matches()) {
            log.warn("[Security] Rejected target name: {}", target);
            throw StewardException.security("Invalid target name: " + target);
        }
        return target;
    }

    /**
     * Follow a state-directory symlink exactly one hop.
     *
     * <p>
     * The target must lie below the project root or an allowed root, and no
     * component between that root and the target may be a link, so the real
     * location is the one that was validated.
     *
     * @return the link target, absolute and normalized
     * @throws StewardException
     *             SECURITY if the target passes through another link or lies
     *             outside the project root and every allowed root
     */
    public Path followStateLink(Path link, Path projectRoot, List<Path> allowedRoots) {
        Path target;
        try {
            target = Files.readSymbolicLink(link);
        } catch (IOException e) {
            throw StewardException.unresolvable("Cannot read state directory link " + link + ": " + e.getMessage());
        }
        Path resolved = link.getParent().resolve(target).toAbsolutePath().normalize();

        List<Path> roots = new ArrayList<>();
        roots.add(projectRoot.toAbsolutePath().normalize());
        allowedRoots.forEach(root -> roots.add(root.toAbsolutePath().normalize()));

        Path anchor = roots.stream()
                .filter(resolved::startsWith)
                .findFirst()
                .orElseThrow(() -> {
                    log.warn("[Security] State directory link escapes allowed roots: {} -> {}", link, resolved);
                    return StewardException.security("State directory link target outside allowed roots: " + resolved);
                });

        Path cursor = anchor;
        for (Path part : anchor.relativize(resolved)) {
            cursor = cursor.resolve(part);
            if (Files.isSymbolicLink(cursor)) {
                log.warn("[Security] Symlink chain refused: {} -> {} via {}", link, resolved, cursor);
                throw StewardException.security("State directory link passes through another link: " + cursor);
            }
        }

        Path real = realPathOfExistingPart(resolved);
        boolean contained = roots.stream()
                .map(PathGuard::realPathOrSelf)
                .anyMatch(real::startsWith);
        if (!contained) {
            log.warn("[Security] State directory link resolves outside allowed roots: {} -> {}", link, real);
            throw StewardException.security("State directory link target outside allowed roots: " + real);
        }
        log.debug("[Security] Followed state directory link {} -> {}", link, resolved);
        return resolved;
    }

    /**
     * Check that a file resolves, after following links, to a readable regular
     * file below {@code allowedRoot}.
     */
    public boolean isContainedRegularFile(Path candidate, Path allowedRoot) {
        try {
            Path real = candidate.toRealPath();
            Path realRoot = allowedRoot.toRealPath();
            if (!real.startsWith(realRoot)) {
                log.warn("[Security] Candidate {} resolves outside {}", candidate, allowedRoot);
                return false;
            }
            return Files.isRegularFile(real, LinkOption.NOFOLLOW_LINKS) && Files.isReadable(real);
        } catch (IOException e) {
            log.debug("[Security] Candidate {} not resolvable: {}", candidate, e.getMessage());
            return false;
        }
    }

    private static Path realPathOfExistingPart(Path path) {
        Path existing = path;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return path;
        }
        Path real = realPathOrSelf(existing);
        return real.resolve(existing.relativize(path)).normalize();
    }

    private static Path realPathOrSelf(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            log.debug("[Security] Cannot resolve real path of {}: {}", path, e.getMessage());
            return path;
        }
    }
}
