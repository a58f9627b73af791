package com.linlay.skillplatform.controller;

import com.linlay.skillplatform.model.api.ApiResponse;
import com.linlay.skillplatform.model.api.CreateNodeRequest;
import com.linlay.skillplatform.model.api.SkillDetailResponse;
import com.linlay.skillplatform.model.api.UpdateDependenciesRequest;
import com.linlay.skillplatform.model.api.UpdateFileRequest;
import com.linlay.skillplatform.skill.SkillArchive;
import com.linlay.skillplatform.skill.SkillContentStore;
import com.linlay.skillplatform.skill.SkillDependencies;
import com.linlay.skillplatform.skill.SkillFileContent;
import com.linlay.skillplatform.skill.SkillMetadataCache;
import com.linlay.skillplatform.skill.SkillMetadataCache.SkillOption;
import com.linlay.skillplatform.skill.SkillStorageException;
import com.linlay.skillplatform.skill.SkillTreeNode;
import com.linlay.skillplatform.skill.SkillValidationException;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Admin surface over the skill content store. Filesystem work runs on the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/ap")
public class SkillController {

    private static final Logger log = LoggerFactory.getLogger(SkillController.class);
    static final String OPERATOR_HEADER = "X-Operator";
    private static final String DEFAULT_OPERATOR = "system";

    private final SkillContentStore contentStore;
    private final SkillMetadataCache metadataCache;

    public SkillController(SkillContentStore contentStore, SkillMetadataCache metadataCache) {
        this.contentStore = contentStore;
        this.metadataCache = metadataCache;
    }

    @GetMapping("/skills")
    public Mono<ApiResponse<List<SkillDetailResponse.SkillDetail>>> skills() {
        return blocking(() -> contentStore.listSkills().stream()
                .map(SkillDetailResponse.SkillDetail::from)
                .toList());
    }

    @GetMapping("/skills/options")
    public ApiResponse<List<SkillOption>> options() {
        return ApiResponse.success(metadataCache.options());
    }

    @GetMapping("/skill")
    public Mono<ApiResponse<SkillDetailResponse>> skill(@RequestParam String skillId) {
        return blocking(() -> new SkillDetailResponse(SkillDetailResponse.SkillDetail.from(contentStore.getSkill(skillId))));
    }

    @PostMapping(value = "/skills/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ApiResponse<SkillDetailResponse>> importSkill(
            @RequestPart("file") FilePart file,
            @RequestHeader(value = OPERATOR_HEADER, required = false) String operator
    ) {
        long maxBytes = contentStore.maxImportBytes();
        return DataBufferUtils.join(file.content(), (int) Math.min(maxBytes, Integer.MAX_VALUE))
                .onErrorMap(DataBufferLimitException.class,
                        ex -> new SkillValidationException("uploaded archive exceeds " + maxBytes + " bytes"))
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .defaultIfEmpty(new byte[0])
                .publishOn(Schedulers.boundedElastic())
                .map(bytes -> contentStore.importArchive(file.filename(), bytes, operator(operator)))
                .map(record -> ApiResponse.success(new SkillDetailResponse(SkillDetailResponse.SkillDetail.from(record))));
    }

    @GetMapping("/skill/export")
    public Mono<ResponseEntity<byte[]>> export(@RequestParam String skillId) {
        return Mono.fromCallable(() -> {
                    SkillArchive archive = contentStore.exportArchive(skillId);
                    try {
                        byte[] bytes = Files.readAllBytes(archive.file());
                        return ResponseEntity.ok()
                                .contentType(MediaType.parseMediaType("application/zip"))
                                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                                        .filename(archive.filename())
                                        .build()
                                        .toString())
                                .body(bytes);
                    } catch (IOException ex) {
                        throw new SkillStorageException("Failed to read export archive of " + skillId, ex);
                    } finally {
                        deleteExport(archive);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/skill/tree")
    public Mono<ApiResponse<List<SkillTreeNode>>> tree(@RequestParam String skillId) {
        return blocking(() -> contentStore.tree(skillId));
    }

    @GetMapping("/skill/file")
    public Mono<ApiResponse<SkillFileContent>> readFile(@RequestParam String skillId, @RequestParam String path) {
        return blocking(() -> contentStore.readFile(skillId, path));
    }

    @PostMapping("/skill/node")
    public Mono<ApiResponse<Map<String, Object>>> createNode(
            @Valid @RequestBody CreateNodeRequest request,
            @RequestHeader(value = OPERATOR_HEADER, required = false) String operator
    ) {
        return blocking(() -> {
            contentStore.createNode(request.skillId(), request.path(), request.directory(), request.content(), operator(operator));
            return Map.of("skillId", request.skillId(), "path", request.path());
        });
    }

    @PutMapping("/skill/file")
    public Mono<ApiResponse<Map<String, Object>>> updateFile(
            @Valid @RequestBody UpdateFileRequest request,
            @RequestHeader(value = OPERATOR_HEADER, required = false) String operator
    ) {
        return blocking(() -> {
            contentStore.updateFile(request.skillId(), request.path(), request.content(), operator(operator));
            return Map.of("skillId", request.skillId(), "path", request.path());
        });
    }

    @DeleteMapping("/skill/node")
    public Mono<ApiResponse<Map<String, Object>>> deleteNode(@RequestParam String skillId, @RequestParam String path) {
        return blocking(() -> {
            contentStore.deleteNode(skillId, path);
            return Map.of("skillId", skillId, "path", path);
        });
    }

    @PutMapping("/skill/dependencies")
    public Mono<ApiResponse<SkillDetailResponse>> updateDependencies(
            @Valid @RequestBody UpdateDependenciesRequest request,
            @RequestHeader(value = OPERATOR_HEADER, required = false) String operator
    ) {
        return blocking(() -> {
            SkillDependencies dependencies = SkillDependencies.fromStrings(
                    request.tools(), request.integrations(), request.skills());
            return new SkillDetailResponse(SkillDetailResponse.SkillDetail.from(
                    contentStore.updateDependencies(request.skillId(), dependencies, operator(operator))));
        });
    }

    @DeleteMapping("/skill")
    public Mono<ApiResponse<Map<String, Object>>> deleteSkill(@RequestParam String skillId) {
        return blocking(() -> {
            contentStore.deleteSkill(skillId);
            return Map.of("skillId", skillId);
        });
    }

    private <T> Mono<ApiResponse<T>> blocking(Callable<T> action) {
        return Mono.fromCallable(action)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ApiResponse::success);
    }

    private String operator(String header) {
        return StringUtils.hasText(header) ? header.trim() : DEFAULT_OPERATOR;
    }

    private void deleteExport(SkillArchive archive) {
        try {
            Files.deleteIfExists(archive.file());
        } catch (IOException ex) {
            log.warn("Cannot remove export archive {}", archive.file(), ex);
        }
    }
}
