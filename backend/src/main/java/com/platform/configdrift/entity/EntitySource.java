package com.platform.configdrift.entity;

import com.platform.configdrift.operation.DashboardContext;
import com.platform.configdrift.operation.OperationScope;

import java.util.List;

/**
 * Lists the entities of a scope.
 */
public interface EntitySource {

    default List<EntityRecord> listEntities(DashboardContext context, OperationScope scope) {
        return listEntities(context, scope, false);
    }

    /**
     * @param acrossOrganizations list networks or devices of every accessible organization
     *                            instead of the context's organization only
     */
    List<EntityRecord> listEntities(DashboardContext context, OperationScope scope, boolean acrossOrganizations);
}
