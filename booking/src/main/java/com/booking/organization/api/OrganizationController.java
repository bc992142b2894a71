package com.booking.organization.api;

import com.booking.organization.domain.Organization;
import com.booking.organization.domain.UpdateOrganization;
import com.booking.organization.service.OrganizationFetcher;
import com.booking.organization.service.OrganizationLister;
import com.booking.organization.service.OrganizationManager;
import com.booking.organization.service.RegisterOrganizationCommand;
import com.booking.shared.paging.Page;
import com.booking.shared.web.DataContainer;
import com.booking.shared.web.PageResponse;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.time.Instant;

/**
 * Organization REST Controller
 *
 * POST   /api/v1/organizations          register
 * GET    /api/v1/organizations/{id}     fetch
 * PATCH  /api/v1/organizations/{id}     modify
 * DELETE /api/v1/organizations/{id}     delete (idempotent)
 * GET    /api/v1/organizations          list, oldest first; 404 when the first page is empty
 *
 * The acting user is taken from the X-User-Id header.
 */
@RestController
@RequestMapping("/api/v1/organizations")
@RequiredArgsConstructor
public class OrganizationController {

    static final String USER_HEADER = "X-User-Id";

    private final OrganizationManager manager;
    private final OrganizationFetcher fetcher;
    private final OrganizationLister lister;

    // ─── Write Endpoints ──────────────────────────────────────────────────────

    @PostMapping
    public ResponseEntity<DataContainer<OrganizationResponse>> register(
            @Valid @RequestBody RegisterOrganizationRequest request,
            @RequestHeader(USER_HEADER) String actor) {

        Organization organization = manager.register(RegisterOrganizationCommand.builder()
                .name(request.getName())
                .actor(actor)
                .build());

        return ResponseEntity
                .created(URI.create("/api/v1/organizations/" + organization.getId()))
                .body(DataContainer.of(OrganizationResponse.from(organization)));
    }

    @PatchMapping("/{organizationId}")
    public DataContainer<OrganizationResponse> modify(
            @PathVariable String organizationId,
            @Valid @RequestBody UpdateOrganizationRequest request,
            @RequestHeader(USER_HEADER) String actor) {

        Organization organization = manager.modifyById(organizationId, actor,
                UpdateOrganization.builder().name(request.getName()).build());
        return DataContainer.of(OrganizationResponse.from(organization));
    }

    @DeleteMapping("/{organizationId}")
    public ResponseEntity<Void> delete(@PathVariable String organizationId,
                                       @RequestHeader(USER_HEADER) String actor) {
        manager.deleteById(organizationId, actor);
        return ResponseEntity.noContent().build();
    }

    // ─── Read Endpoints ───────────────────────────────────────────────────────

    @GetMapping("/{organizationId}")
    public DataContainer<OrganizationResponse> get(@PathVariable String organizationId) {
        return DataContainer.of(OrganizationResponse.from(fetcher.getById(organizationId)));
    }

    @GetMapping
    public ResponseEntity<DataContainer<PageResponse<OrganizationResponse>>> list(
            @RequestParam(name = "page_size", required = false) Integer pageSize,
            @RequestParam(name = "page_token", required = false) String pageToken) {

        Page<Organization> page = lister.list(pageSize, pageToken);
        // past the first page an empty result is the end of the listing, not a miss
        if (page.isEmpty() && pageToken == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(DataContainer.of(PageResponse.of(page, OrganizationResponse::from)));
    }
}

// ─── Request / Response DTOs ───────────────────────────────────────────────────

@Data
class RegisterOrganizationRequest {
    @NotBlank @Size(max = 256) private String name;
}

@Data
class UpdateOrganizationRequest {
    @Size(min = 1, max = 256) private String name;
}

@Data
@lombok.Builder
class OrganizationResponse {
    @JsonProperty("organization_id") private String organizationId;
    private String name;
    @JsonProperty("create_time") private Instant createTime;
    @JsonProperty("create_by") private String createBy;
    @JsonProperty("last_update_time") private Instant lastUpdateTime;
    @JsonProperty("last_update_by") private String lastUpdateBy;
    private long version;

    static OrganizationResponse from(Organization organization) {
        return OrganizationResponse.builder()
                .organizationId(organization.getId())
                .name(organization.getName())
                .createTime(organization.getCreateTime())
                .createBy(organization.getCreateBy())
                .lastUpdateTime(organization.getLastUpdateTime())
                .lastUpdateBy(organization.getLastUpdateBy())
                .version(organization.getVersion())
                .build();
    }
}
