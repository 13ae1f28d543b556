package com.tlmbackup.server.util;

import com.tlmbackup.server.exception.FileOperationException;
import com.tlmbackup.server.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

@Slf4j
public class FilesystemUtil {

    private static final int BUFFER_SIZE = 64 * 1024;

    private static final Pattern UNSAFE_FILE_NAME_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

    // 不存在则创建
    public static Path ensureFolder(Path folder) throws ValidationException, FileOperationException {
        if (folder == null) {
            throw new ValidationException("ensureFolder failed. folder is null");
        }
        if (Files.exists(folder) && !Files.isDirectory(folder)) {
            throw new FileOperationException("ensureFolder failed. %s exists but is not a folder".formatted(folder));
        }
        try {
            return Files.createDirectories(folder);
        } catch (IOException e) {
            throw new FileOperationException("ensureFolder failed. folder is %s".formatted(folder), e);
        }
    }

    // job 名可能带 ':' ',' 等字符, 替换为 '_' 后才能用作文件名
    public static String toFileNamePart(String name) {
        if (name == null || name.isBlank()) {
            return "_";
        }
        return UNSAFE_FILE_NAME_CHARS.matcher(name.strip()).replaceAll("_");
    }

    /**
     * Writes every file into one deflated ZIP archive, entries named after the file name.
     * A half-written archive is removed when writing fails.
     */
    public static Path zipFiles(List<Path> files, Path zipFile)
            throws ValidationException, FileOperationException {
        // 检查参数
        if (CollectionUtils.isEmpty(files) || zipFile == null) {
            throw new ValidationException("zipFiles failed. files is empty or zipFile is null");
        }
        try (ZipOutputStream zos = new ZipOutputStream(Files.newOutputStream(zipFile))) {
            zos.setLevel(6);
            for (Path file : files) {
                zos.putNextEntry(new ZipEntry(file.getFileName().toString()));
                Files.copy(file, zos);
                zos.closeEntry();
            }
        } catch (IOException e) {
            deleteQuietly(zipFile);
            throw new FileOperationException("zipFiles failed. zipFile is %s".formatted(zipFile), e);
        }
        return zipFile;
    }

    public static String sha256(Path file) throws ValidationException, FileOperationException {
        if (file == null || !Files.isRegularFile(file)) {
            throw new ValidationException("sha256 failed. %s is not a file".formatted(file));
        }
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new FileOperationException("sha256 failed. SHA-256 not supported", e);
        }
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream inputStream = Files.newInputStream(file)) {
            int read;
            while ((read = inputStream.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        } catch (IOException e) {
            throw new FileOperationException("sha256 failed. file is %s".formatted(file), e);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    public static long size(Path file) throws FileOperationException {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new FileOperationException("size failed. file is %s".formatted(file), e);
        }
    }

    // 清理中间文件, 失败只记录日志
    public static boolean deleteQuietly(Path file) {
        if (file == null) {
            return false;
        }
        boolean deleted = FileUtils.deleteQuietly(file.toFile());
        if (!deleted && Files.exists(file)) {
            log.warn("deleteQuietly failed. {} still exists", file);
        }
        return deleted;
    }

    public static double toMegabytes(long bytes) {
        return bytes / 1024.0 / 1024.0;
    }

    public static String formatMegabytes(long bytes) {
        return "%.2f MB".formatted(toMegabytes(bytes));
    }
}
