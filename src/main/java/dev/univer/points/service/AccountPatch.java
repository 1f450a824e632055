package dev.univer.points.service;

import dev.univer.points.model.AccountRole;
import dev.univer.points.model.AccountStatus;
import lombok.Builder;

/** Null fields are left as they are. Balance is not patchable; it only moves through mutations. */
@Builder
public record AccountPatch(String fullName,
                           String phone,
                           String username,
                           AccountRole role,
                           AccountStatus status,
                           String groupId) {
}
