package com.demoLibrary.multiModel.aggregate.query;

import com.demoLibrary.multiModel.aggregate.model.RequestContext;
import com.demoLibrary.multiModel.aggregate.view.FlatMultipleModelView;

/**
 * Generic request-level filtering applied identically to every source of a view.
 */
public interface FilterBackend {

    <T> EntityQuery<T> filterQueryset(EntityQuery<T> query, RequestContext request, FlatMultipleModelView view);
}
