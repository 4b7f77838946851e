package io.github.samzhu.metering.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.metering.document.Organization;
import io.github.samzhu.metering.dto.api.OrganizationRequest;
import io.github.samzhu.metering.service.OrganizationService;

/**
 * 組織管理 API 控制器。
 */
@RestController
@RequestMapping("/api/v1/orgs")
public class OrganizationApiController {

    private static final Logger log = LoggerFactory.getLogger(OrganizationApiController.class);

    private final OrganizationService organizationService;

    public OrganizationApiController(OrganizationService organizationService) {
        this.organizationService = organizationService;
    }

    /**
     * 建立或更新組織的方案與計費錨定日。
     *
     * @param orgId 組織 ID
     * @param request 組織資料
     * @return 儲存後的組織
     */
    @PutMapping("/{orgId}")
    public ResponseEntity<Organization> putOrganization(
            @PathVariable long orgId,
            @RequestBody @Validated OrganizationRequest request) {
        log.debug("Registering organization: orgId={}, plan={}", orgId, request.planTier());
        return ResponseEntity.ok(organizationService.register(orgId, request));
    }

    /**
     * 取得組織。
     *
     * @param orgId 組織 ID
     * @return 組織
     */
    @GetMapping("/{orgId}")
    public ResponseEntity<Organization> getOrganization(@PathVariable long orgId) {
        return ResponseEntity.ok(organizationService.require(orgId));
    }
}
