package com.booking.organization.service;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RegisterOrganizationCommand {
    private String name;
    /** User registering the organization; becomes createBy. */
    private String actor;
}
