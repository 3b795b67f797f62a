package com.clipforge.infrastructure.gateway.storage;

import com.clipforge.domain.production.adapter.gateway.IArtifactStorageGateway;
import com.clipforge.domain.production.model.valobj.ArtifactRef;
import com.clipforge.infrastructure.gateway.HttpErrorClassifier;
import com.clipforge.types.exception.ConfigurationException;
import com.clipforge.types.exception.TransientProviderException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * 本地文件系统素材存储。
 * <p>
 * 结果文件按日期分目录保存为 {jobId}.mp4，公开地址由 public-base-url 拼接。
 * 先写临时文件再原子移动，避免半截文件被当作素材。
 * </p>
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "clipforge.storage.type", havingValue = "local", matchIfMissing = true)
public class LocalArtifactStorageGateway implements IArtifactStorageGateway {

    private static final DateTimeFormatter DATE_DIR = DateTimeFormatter.ofPattern("yyyy/MM/dd");

    private final RestTemplate restTemplate;
    private final Clock clock;
    private final Path rootDir;
    private final String publicBaseUrl;

    public LocalArtifactStorageGateway(@Qualifier("storageRestTemplate") RestTemplate restTemplate,
                                       Clock clock,
                                       @Value("${clipforge.storage.local.root-dir:./data/artifacts}") String rootDir,
                                       @Value("${clipforge.storage.local.public-base-url:http://localhost:8080/artifacts}") String publicBaseUrl) {
        this.restTemplate = restTemplate;
        this.clock = clock;
        this.rootDir = Paths.get(rootDir).toAbsolutePath().normalize();
        this.publicBaseUrl = StringUtils.removeEnd(publicBaseUrl, "/");
        try {
            Files.createDirectories(this.rootDir);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot create artifact directory " + this.rootDir, e);
        }
        log.info("Local artifact storage ready. rootDir={}", this.rootDir);
    }

    @Override
    public ArtifactRef store(String sourceUrl, String jobId) {
        if (StringUtils.isBlank(sourceUrl)) {
            throw new IllegalArgumentException("sourceUrl is blank");
        }
        if (StringUtils.isBlank(jobId)) {
            throw new IllegalArgumentException("jobId is blank");
        }
        String storageKey = LocalDate.now(clock).format(DATE_DIR) + "/" + jobId + ".mp4";
        Path target = rootDir.resolve(storageKey);
        Long size;
        try {
            Files.createDirectories(target.getParent());
            size = restTemplate.execute(sourceUrl, HttpMethod.GET, null,
                    response -> copyAtomically(response.getBody(), target));
        } catch (RestClientException ex) {
            throw HttpErrorClassifier.classify("Artifact download", ex);
        } catch (IOException ex) {
            throw new TransientProviderException("Failed to write artifact " + storageKey, ex);
        }
        long sizeBytes = size == null ? 0L : size;
        log.info("Artifact stored. jobId={}, storageKey={}, sizeBytes={}", jobId, storageKey, sizeBytes);
        return new ArtifactRef(storageKey, publicBaseUrl + "/" + storageKey, sizeBytes);
    }

    private Long copyAtomically(InputStream body, Path target) throws IOException {
        Path temp = target.resolveSibling(target.getFileName() + ".part");
        try (InputStream in = body) {
            Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | RuntimeException ex) {
            // 失败时清理残留的临时文件，原异常继续抛出
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                ex.addSuppressed(cleanup);
            }
            throw ex;
        }
        return Files.size(target);
    }
}
