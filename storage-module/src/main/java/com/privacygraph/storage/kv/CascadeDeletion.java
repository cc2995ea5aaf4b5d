package com.privacygraph.storage.kv;

import com.privacygraph.common.model.EntityRecord;

import java.util.List;

/**
 * Удалённая сущность и связи, удалённые вместе с ней
 */
public record CascadeDeletion(EntityRecord entity, List<String> removedRelationshipIds) {
}
