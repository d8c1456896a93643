package com.webtext.core.service;

import com.webtext.core.model.ExtractConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * 실행 전 점검(네트워크 작업 전에 끝낸다):
 *  - 입력 파일 존재 + 확장자(.txt)
 *  - 출력 경로가 일반 파일이면 실패
 *  - 출력 디렉터리가 없으면: 기본 경로는 그냥 생성, 그 외는 확인 후 생성(거절 시 기본 경로로)
 */
public final class OutputDirectoryResolver {

    private static final Logger LOG = LoggerFactory.getLogger(OutputDirectoryResolver.class);

    private final ExtractConfig config;
    private final DirectoryConfirmation confirmation;

    public OutputDirectoryResolver(ExtractConfig config, DirectoryConfirmation confirmation) {
        this.config = Objects.requireNonNull(config, "config");
        this.confirmation = Objects.requireNonNull(confirmation, "confirmation");
    }

    public void checkInput(Path inputFile) throws PreflightException {
        if (inputFile == null || !Files.exists(inputFile)) {
            throw new PreflightException("File " + inputFile + " does not exist.");
        }
        String name = String.valueOf(inputFile.getFileName());
        if (Files.isDirectory(inputFile) || !name.endsWith(config.getInputSuffix())) {
            throw new PreflightException("File " + inputFile + " is not a text file.");
        }
    }

    /** @param requested null이면 기본 출력 디렉터리 */
    public Path resolve(Path requested) throws PreflightException {
        Path defaultDir = config.getDefaultOutputDir();
        Path dir = (requested == null) ? defaultDir : requested;

        if (Files.isRegularFile(dir)) {
            throw new PreflightException("Output path " + dir + " is not a directory.");
        }
        if (Files.isDirectory(dir)) return dir;

        if (!isDefault(dir)) {
            LOG.debug("Output path {} does not exist, asking before creating it", dir);
            if (!confirmation.confirmCreate(dir)) {
                dir = defaultDir;
                LOG.info("Output path set to {}", dir);
                if (Files.isRegularFile(dir)) {
                    throw new PreflightException("Output path " + dir + " is not a directory.");
                }
            }
        }
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new PreflightException("Could not create output directory " + dir + ": " + e.getMessage(), e);
        }
        return dir;
    }

    /** 입력 점검 후 출력 디렉터리를 확정한다. */
    public Path prepare(Path inputFile, Path requestedOutput) throws PreflightException {
        checkInput(inputFile);
        return resolve(requestedOutput);
    }

    private boolean isDefault(Path dir) {
        Path def = config.getDefaultOutputDir();
        return dir.toAbsolutePath().normalize().equals(def.toAbsolutePath().normalize());
    }
}
