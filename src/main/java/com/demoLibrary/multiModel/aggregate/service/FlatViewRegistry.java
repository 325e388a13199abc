package com.demoLibrary.multiModel.aggregate.service;

import com.demoLibrary.multiModel.aggregate.exception.UnknownViewException;
import com.demoLibrary.multiModel.aggregate.view.FlatMultipleModelView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.TreeMap;

/**
 * Looks up flat views by their route name.
 * 
 * Every {@link FlatMultipleModelView} bean is registered under its bean name; the
 * configured sorting parameter name is applied to views still using the default.
 */
@Slf4j
@Service
public class FlatViewRegistry {

    private final Map<String, FlatMultipleModelView> views;

    public FlatViewRegistry(Map<String, FlatMultipleModelView> viewBeans,
                            @Value("${multi-model.sorting-parameter-name:o}") String sortingParameterName) {
        this.views = new TreeMap<>(viewBeans);
        for (FlatMultipleModelView view : views.values()) {
            if (FlatMultipleModelView.DEFAULT_SORTING_PARAMETER_NAME.equals(view.getSortingParameterName())) {
                view.setSortingParameterName(sortingParameterName);
            }
        }
        log.info("Registered flat views: {}", views.keySet());
    }

    public FlatMultipleModelView get(String name) {
        FlatMultipleModelView view = views.get(name);
        if (view == null) {
            throw new UnknownViewException(name);
        }
        return view;
    }

    public Map<String, FlatMultipleModelView> getAll() {
        return Map.copyOf(views);
    }
}
