package com.mcpgate.mcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.mcpgate.mcp.security.ClientSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.*;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.util.*;
import java.util.stream.Stream;

/**
 * Read-only file tools sandboxed under a root directory.
 */
public class FileTools implements ToolProvider {
    private static final Logger logger = LoggerFactory.getLogger(FileTools.class);

    private final Path rootDirectory;
    private final long maxFileSize;
    private final List<ToolDefinition> definitions;

    public FileTools(Path rootDirectory, long maxFileSize) {
        this.rootDirectory = rootDirectory.toAbsolutePath().normalize();
        this.maxFileSize = maxFileSize;
        this.definitions = List.of(
                new ToolDefinition("list_files", "List files in a directory with detailed information",
                        SchemaBuilder.object()
                                .string("path", "Directory path to list, relative to the server root", ".")
                                .bool("include_hidden", "Include hidden files", false)
                                .build()),
                new ToolDefinition("read_file", "Read contents of a text file safely",
                        SchemaBuilder.object()
                                .string("path", "File path to read, relative to the server root", true)
                                .string("encoding", "File encoding", "utf-8")
                                .integer("max_size", "Maximum file size in bytes", maxFileSize)
                                .build()));
    }

    @Override
    public String getName() {
        return "files";
    }

    @Override
    public List<ToolDefinition> getToolDefinitions() {
        return definitions;
    }

    @Override
    public ToolHandler getHandler(String toolName) {
        return switch (toolName) {
            case "list_files" -> this::listFiles;
            case "read_file" -> this::readFile;
            default -> null;
        };
    }

    ToolResult listFiles(JsonNode arguments, ClientSession session) {
        String requestedPath = arguments.path("path").asText(".");
        boolean includeHidden = arguments.path("include_hidden").asBoolean(false);

        Path directory;
        try {
            directory = resolveInsideRoot(requestedPath);
        } catch (IllegalArgumentException e) {
            return ToolResult.error("Error: " + e.getMessage());
        }
        if (!Files.isDirectory(directory)) {
            return ToolResult.error("Error: " + requestedPath + " is not a directory");
        }

        List<FileEntry> fileEntries = new ArrayList<>();
        try (Stream<Path> children = Files.list(directory)) {
            children.forEach(child -> {
                FileEntry fileEntry = describe(child);
                if (includeHidden || !fileEntry.hidden()) {
                    fileEntries.add(fileEntry);
                }
            });
        } catch (AccessDeniedException e) {
            return ToolResult.error("Error: Permission denied accessing " + requestedPath);
        } catch (IOException e) {
            logger.warn("Failed to list {}", directory, e);
            return ToolResult.error("Error: Cannot list " + requestedPath + ": " + e.getMessage());
        }

        fileEntries.sort(Comparator.comparing((FileEntry entry) -> !"directory".equals(entry.type()))
                .thenComparing(entry -> entry.name().toLowerCase(Locale.ROOT)));

        StringBuilder listingText = new StringBuilder("Directory Listing: ").append(requestedPath).append("\n\n");
        listingText.append("Total items: ").append(fileEntries.size());
        if (fileEntries.isEmpty()) {
            listingText.append("\n\nDirectory is empty");
        } else {
            listingText.append("\n\n");
            for (FileEntry fileEntry : fileEntries) {
                if (fileEntry.error() != null) {
                    listingText.append(fileEntry.name()).append(": ERROR ").append(fileEntry.error()).append('\n');
                    continue;
                }
                listingText.append(fileEntry.name()).append(fileEntry.hidden() ? " (hidden)" : "").append('\n');
                listingText.append("   Type: ").append(fileEntry.type()).append('\n');
                if (fileEntry.size() != null) {
                    listingText.append("   Size: ").append(formatSize(fileEntry.size())).append('\n');
                }
                listingText.append("   Permissions: ").append(fileEntry.permissions()).append('\n');
                listingText.append("   Modified: ").append(fileEntry.modified()).append("\n\n");
            }
        }
        return ToolResult.text(listingText.toString().stripTrailing());
    }

    ToolResult readFile(JsonNode arguments, ClientSession session) {
        JsonNode pathNode = arguments.path("path");
        if (!pathNode.isTextual() || pathNode.asText().isBlank()) {
            return ToolResult.error("Error: 'path' is required");
        }
        String requestedPath = pathNode.asText();
        String encoding = arguments.path("encoding").asText("utf-8");
        long sizeLimit = Math.min(arguments.path("max_size").asLong(maxFileSize), maxFileSize);

        Path file;
        try {
            file = resolveInsideRoot(requestedPath);
        } catch (IllegalArgumentException e) {
            return ToolResult.error("Error: " + e.getMessage());
        }
        if (!Files.isRegularFile(file)) {
            return ToolResult.error("Error: " + requestedPath + " is not a file");
        }

        Charset charset;
        try {
            charset = Charset.forName(encoding);
        } catch (IllegalArgumentException e) {
            return ToolResult.error("Error: Unsupported encoding '" + encoding + "'");
        }

        long fileSize;
        String fileContent;
        try {
            fileSize = Files.size(file);
            if (fileSize > sizeLimit) {
                return ToolResult.error("Error: File size (" + fileSize + " bytes) exceeds maximum allowed size ("
                        + sizeLimit + " bytes)");
            }
            CharsetDecoder decoder = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);
            fileContent = decoder.decode(ByteBuffer.wrap(Files.readAllBytes(file))).toString();
        } catch (CharacterCodingException e) {
            return ToolResult.error("Error: Cannot decode file with encoding '" + encoding + "'. Try a different encoding.");
        } catch (AccessDeniedException e) {
            return ToolResult.error("Error: Permission denied reading " + requestedPath);
        } catch (IOException e) {
            logger.warn("Failed to read {}", file, e);
            return ToolResult.error("Error reading file: " + e.getMessage());
        }

        FileEntry fileEntry = describe(file);
        String separator = "-".repeat(50);
        String responseText = "File Contents: " + requestedPath + "\n\n" +
                "File Information:\n" +
                "- Size: " + fileSize + " bytes\n" +
                "- Encoding: " + encoding + "\n" +
                "- Permissions: " + fileEntry.permissions() + "\n" +
                "- Modified: " + fileEntry.modified() + "\n\n" +
                "Content:\n" + separator + "\n" + fileContent + "\n" + separator;
        return ToolResult.text(responseText);
    }

    /**
     * Resolves a client supplied path against the root, refusing anything that escapes it,
     * including through symbolic links.
     */
    Path resolveInsideRoot(String requestedPath) {
        Path resolved;
        try {
            resolved = rootDirectory.resolve(requestedPath).normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid path " + requestedPath + ": " + e.getReason());
        }
        if (!resolved.startsWith(rootDirectory)) {
            throw new IllegalArgumentException("Path " + requestedPath + " is outside the allowed directory");
        }
        if (Files.exists(resolved)) {
            try {
                Path realPath = resolved.toRealPath();
                if (!realPath.startsWith(rootDirectory.toRealPath())) {
                    throw new IllegalArgumentException("Path " + requestedPath + " is outside the allowed directory");
                }
            } catch (IOException e) {
                throw new IllegalArgumentException("Invalid path " + requestedPath + ": " + e.getMessage());
            }
        }
        return resolved;
    }

    record FileEntry(String name, String type, Long size, String permissions, String modified, boolean hidden,
                     String error) {
    }

    private static FileEntry describe(Path path) {
        String name = path.getFileName().toString();
        boolean hidden = name.startsWith(".");
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            String type;
            if (attributes.isSymbolicLink()) {
                type = "symlink";
            } else if (attributes.isDirectory()) {
                type = "directory";
            } else if (attributes.isRegularFile()) {
                type = "file";
            } else {
                type = "other";
            }
            Long size = attributes.isRegularFile() ? attributes.size() : null;
            return new FileEntry(name, type, size, permissionString(path), attributes.lastModifiedTime().toString(),
                    hidden, null);
        } catch (IOException e) {
            return new FileEntry(name, "error", null, null, null, hidden, e.getMessage());
        }
    }

    static String permissionString(Path path) {
        try {
            Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(path, LinkOption.NOFOLLOW_LINKS);
            return permissionChar(permissions, PosixFilePermission.OWNER_READ, 'r')
                    + permissionChar(permissions, PosixFilePermission.OWNER_WRITE, 'w')
                    + permissionChar(permissions, PosixFilePermission.OWNER_EXECUTE, 'x')
                    + permissionChar(permissions, PosixFilePermission.GROUP_READ, 'r')
                    + permissionChar(permissions, PosixFilePermission.GROUP_WRITE, 'w')
                    + permissionChar(permissions, PosixFilePermission.GROUP_EXECUTE, 'x')
                    + permissionChar(permissions, PosixFilePermission.OTHERS_READ, 'r')
                    + permissionChar(permissions, PosixFilePermission.OTHERS_WRITE, 'w')
                    + permissionChar(permissions, PosixFilePermission.OTHERS_EXECUTE, 'x');
        } catch (UnsupportedOperationException | IOException e) {
            // Non-POSIX file systems
            return (Files.isReadable(path) ? "r" : "-") + (Files.isWritable(path) ? "w" : "-")
                    + (Files.isExecutable(path) ? "x" : "-") + "------";
        }
    }

    private static String permissionChar(Set<PosixFilePermission> permissions, PosixFilePermission permission, char flag) {
        return permissions.contains(permission) ? String.valueOf(flag) : "-";
    }

    static String formatSize(long sizeBytes) {
        if (sizeBytes < 1024) {
            return sizeBytes + "B";
        }
        if (sizeBytes < 1024L * 1024) {
            return String.format(Locale.ROOT, "%.1fKB", sizeBytes / 1024.0);
        }
        if (sizeBytes < 1024L * 1024 * 1024) {
            return String.format(Locale.ROOT, "%.1fMB", sizeBytes / (1024.0 * 1024));
        }
        return String.format(Locale.ROOT, "%.1fGB", sizeBytes / (1024.0 * 1024 * 1024));
    }
}
