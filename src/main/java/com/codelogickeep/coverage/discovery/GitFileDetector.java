package com.codelogickeep.coverage.discovery;

import com.codelogickeep.coverage.config.AppConfig;
import com.codelogickeep.coverage.exception.CoverageException;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.Status;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.RawTextComparator;
import org.eclipse.jgit.errors.NoWorkTreeException;
import org.eclipse.jgit.errors.RevisionSyntaxException;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.treewalk.AbstractTreeIterator;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.codelogickeep.coverage.exception.CoverageException.ErrorCode.*;

/**
 * 基于 JGit 的变更文件检测，支持 monorepo 子包
 *
 * 检测顺序：
 * 1. baseBranch 与 HEAD 之间的提交差异
 * 2. 基准无法比较或没有提交差异时，改用未提交的更改
 * 3. 仍然没有属于本包的源文件时，返回包内全部源文件
 *
 * 找不到 Git 仓库时抛出 VCS_UNAVAILABLE，由调用方决定如何降级。
 */
@Slf4j
public class GitFileDetector implements FileDetector {

    private final SourceFileSelector selector;
    private final List<String> manifestFiles;
    private final File ceilingDirectory;

    public GitFileDetector() {
        this(new AppConfig.DiscoveryConfig());
    }

    public GitFileDetector(AppConfig.DiscoveryConfig config) {
        this(config, null);
    }

    /**
     * @param ceilingDirectory repository search stops below this directory, may be {@code null}
     */
    GitFileDetector(AppConfig.DiscoveryConfig config, File ceilingDirectory) {
        this.selector = new SourceFileSelector(config.getExtensions(), config.getExcludePatterns());
        this.manifestFiles = config.getManifestFiles() == null ? List.of() : List.copyOf(config.getManifestFiles());
        this.ceilingDirectory = ceilingDirectory;
    }

    @Override
    public List<String> targetFiles(String baseBranch, Path packageRoot) {
        Path workingDir = resolvePackageRoot(packageRoot);

        File gitDir = findGitDir(workingDir);
        if (gitDir == null) {
            throw new CoverageException(VCS_UNAVAILABLE,
                    "Not a Git repository (searched from: " + workingDir + ")",
                    "Package: " + workingDir);
        }

        try (Repository repository = new FileRepositoryBuilder().setGitDir(gitDir).setMustExist(true).build();
             Git git = Git.wrap(repository)) {
            Path gitRoot = repository.getWorkTree().toPath().toRealPath();
            String relativePackage = relativePackagePath(workingDir, gitRoot);

            log.info("Git repository found at: {}", gitRoot);
            log.info("Current package: {}", relativePackage.isEmpty() ? "<repository root>" : relativePackage);

            return detect(git, baseBranch, workingDir, relativePackage);
        } catch (NoWorkTreeException e) {
            throw new CoverageException(VCS_UNAVAILABLE,
                    "Git repository has no working tree: " + gitDir,
                    "Package: " + workingDir, e);
        } catch (IOException e) {
            throw new CoverageException(DISCOVERY_FAILED,
                    "Failed to open Git repository: " + e.getMessage(),
                    "Git dir: " + gitDir, e);
        }
    }

    private List<String> detect(Git git, String baseBranch, Path workingDir, String relativePackage) {
        List<String> committed = diffAgainstBase(git.getRepository(), baseBranch);

        if (committed != null && !committed.isEmpty()) {
            log.info("Found {} modified file(s) compared to {}", committed.size(), baseBranch);
            List<String> filtered = filterAndAdjustPaths(committed, relativePackage);
            if (filtered.isEmpty()) {
                log.info("No modified source files found in this package. Analyzing all source files.");
                return allSourceFiles(workingDir);
            }
            log.info("Analyzing {} modified file(s) compared to {}", filtered.size(), baseBranch);
            return filtered;
        }

        if (committed == null) {
            log.info("Falling back to uncommitted changes...");
        } else {
            log.info("No committed changes found. Checking uncommitted changes...");
        }

        List<String> uncommitted = uncommittedChanges(git);
        if (uncommitted == null) {
            log.info("Uncommitted changes unavailable. Analyzing all source files in the package.");
            return allSourceFiles(workingDir);
        }

        List<String> filtered = filterAndAdjustPaths(uncommitted, relativePackage);
        if (filtered.isEmpty()) {
            log.info("No modified source files found in this package. Analyzing all source files.");
            return allSourceFiles(workingDir);
        }
        log.info("Analyzing {} modified file(s) from uncommitted changes", filtered.size());
        return filtered;
    }

    /**
     * 等价于 {@code git diff --name-only <base> HEAD}；无法比较时返回 null
     */
    private List<String> diffAgainstBase(Repository repository, String baseBranch) {
        if (baseBranch == null || baseBranch.isBlank()) {
            return null;
        }
        try {
            ObjectId base = repository.resolve(baseBranch);
            ObjectId head = repository.resolve("HEAD");
            if (base == null || head == null) {
                log.warn("Git diff failed: cannot resolve '{}'{}", baseBranch, head == null ? " or HEAD" : "");
                return null;
            }
            return getDiffsBetweenCommits(repository, base, head).stream()
                    .map(d -> d.getNewPath().equals(DiffEntry.DEV_NULL) ? d.getOldPath() : d.getNewPath())
                    .distinct()
                    .collect(Collectors.toList());
        } catch (IOException | RevisionSyntaxException e) {
            log.warn("Git diff failed: {}", e.getMessage());
            return null;
        }
    }

    private List<String> uncommittedChanges(Git git) {
        try {
            Status status = git.status().call();

            Set<String> allChangedFiles = new TreeSet<>();
            allChangedFiles.addAll(status.getModified());
            allChangedFiles.addAll(status.getChanged());
            allChangedFiles.addAll(status.getUntracked());
            allChangedFiles.addAll(status.getAdded());
            allChangedFiles.addAll(status.getRemoved());
            allChangedFiles.addAll(status.getMissing());

            log.info("Found {} uncommitted file(s) in repository", allChangedFiles.size());
            return new ArrayList<>(allChangedFiles);
        } catch (GitAPIException | NoWorkTreeException e) {
            log.warn("Git status failed: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public List<String> allSourceFiles(Path packageRoot) {
        if (!Files.isDirectory(packageRoot)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(packageRoot)) {
            return paths
                    .filter(Files::isRegularFile)
                    .map(p -> packageRoot.relativize(p).toString().replace('\\', '/'))
                    .filter(p -> !p.startsWith(".git/") && !p.contains("/.git/"))
                    .filter(selector::isSourceFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new CoverageException(DISCOVERY_FAILED,
                    "Failed to scan package for source files: " + e.getMessage(),
                    "Package: " + packageRoot, e);
        }
    }

    @Override
    public List<String> generateIncludePatterns(List<String> files) {
        List<String> patterns = new ArrayList<>();
        for (String file : files) {
            if (!selector.hasSourceExtension(file)) {
                continue;
            }
            if (file.startsWith("/")) {
                int libIndex = file.indexOf("/lib/");
                if (libIndex != -1) {
                    patterns.add("**/" + file.substring(libIndex + 1));
                } else {
                    patterns.add("**/" + file.substring(file.lastIndexOf('/') + 1));
                }
            } else {
                int libIndex = file.indexOf("lib/");
                patterns.add("**/" + (libIndex != -1 ? file.substring(libIndex) : file));
            }
        }
        return patterns;
    }

    @Override
    public boolean validatePackageStructure(Path packageRoot) {
        if (packageRoot == null || !Files.isDirectory(packageRoot)) {
            return false;
        }
        if (manifestFiles.isEmpty()) {
            return true;
        }
        return manifestFiles.stream().anyMatch(m -> Files.isRegularFile(packageRoot.resolve(m)));
    }

    /**
     * 只保留本包内的源文件，并把路径改写为相对包根目录
     */
    List<String> filterAndAdjustPaths(List<String> files, String relativePackage) {
        String prefix = relativePackage.isEmpty() ? "" : relativePackage + "/";
        return files.stream()
                .filter(f -> f != null && !f.isEmpty())
                .filter(f -> f.startsWith(prefix))
                .map(f -> f.substring(prefix.length()))
                .filter(selector::isSourceFile)
                .collect(Collectors.toList());
    }

    static String relativePackagePath(Path workingDir, Path gitRoot) {
        if (workingDir.equals(gitRoot) || !workingDir.startsWith(gitRoot)) {
            return "";
        }
        return gitRoot.relativize(workingDir).toString().replace('\\', '/');
    }

    private File findGitDir(Path workingDir) {
        FileRepositoryBuilder builder = new FileRepositoryBuilder();
        if (ceilingDirectory != null) {
            builder.addCeilingDirectory(ceilingDirectory);
        }
        return builder.findGitDir(workingDir.toFile()).getGitDir();
    }

    private Path resolvePackageRoot(Path packageRoot) {
        Path root = packageRoot == null ? Path.of(".") : packageRoot;
        if (!Files.isDirectory(root)) {
            throw new CoverageException(INVALID_PACKAGE,
                    "Package root is not a directory: " + root.toAbsolutePath(),
                    "Package: " + root);
        }
        try {
            return root.toRealPath();
        } catch (IOException e) {
            throw new CoverageException(INVALID_PACKAGE,
                    "Cannot resolve package root: " + e.getMessage(),
                    "Package: " + root, e);
        }
    }

    private List<DiffEntry> getDiffsBetweenCommits(Repository repository, ObjectId fromCommit, ObjectId toCommit) throws IOException {
        try (DiffFormatter formatter = new DiffFormatter(new ByteArrayOutputStream())) {
            formatter.setRepository(repository);
            formatter.setDiffComparator(RawTextComparator.DEFAULT);
            formatter.setDetectRenames(true);

            AbstractTreeIterator fromTree = prepareTreeParser(repository, fromCommit);
            AbstractTreeIterator toTree = prepareTreeParser(repository, toCommit);

            return formatter.scan(fromTree, toTree);
        }
    }

    private AbstractTreeIterator prepareTreeParser(Repository repository, ObjectId objectId) throws IOException {
        try (RevWalk walk = new RevWalk(repository)) {
            RevCommit commit = walk.parseCommit(objectId);
            ObjectId treeId = commit.getTree().getId();

            try (ObjectReader reader = repository.newObjectReader()) {
                CanonicalTreeParser treeParser = new CanonicalTreeParser();
                treeParser.reset(reader, treeId);
                return treeParser;
            }
        }
    }
}
