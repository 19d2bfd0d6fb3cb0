package com.namehub.controller;

import com.namehub.controller.dto.RegistryRequests;
import com.namehub.controller.dto.RegistryResponses;
import com.namehub.mapper.RegistryResponseMapper;
import com.namehub.service.NameContentService;
import com.namehub.web.CallerPrincipal;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/names/{name}")
@RequiredArgsConstructor
public class NameContentController {

    private final NameContentService nameContentService;
    private final RegistryResponseMapper registryResponseMapper;

    @GetMapping("/metadata")
    public ResponseEntity<RegistryResponses.MetadataDetail> getMetadata(@PathVariable String name) {
        return ResponseEntity.ok(registryResponseMapper.toMetadataDetail(nameContentService.getMetadata(name)));
    }

    @PutMapping("/metadata")
    public ResponseEntity<RegistryResponses.MetadataDetail> saveMetadata(
            @RequestHeader(name = CallerPrincipal.HEADER, required = false) String principal,
            @PathVariable String name,
            @Valid @RequestBody RegistryRequests.SaveMetadataRequest request
    ) {
        return ResponseEntity.ok(registryResponseMapper.toMetadataDetail(nameContentService.saveMetadata(
                CallerPrincipal.resolve(principal),
                name,
                request.title(),
                request.description(),
                request.image()
        )));
    }

    @GetMapping("/markdown")
    public ResponseEntity<RegistryResponses.MarkdownDetail> getMarkdown(@PathVariable String name) {
        return ResponseEntity.ok(registryResponseMapper.toMarkdownDetail(nameContentService.getMarkdown(name)));
    }

    @PutMapping("/markdown")
    public ResponseEntity<RegistryResponses.MarkdownDetail> saveMarkdown(
            @RequestHeader(name = CallerPrincipal.HEADER, required = false) String principal,
            @PathVariable String name,
            @Valid @RequestBody RegistryRequests.SaveMarkdownRequest request
    ) {
        return ResponseEntity.ok(registryResponseMapper.toMarkdownDetail(nameContentService.saveMarkdown(
                CallerPrincipal.resolve(principal),
                name,
                request.content()
        )));
    }
}
