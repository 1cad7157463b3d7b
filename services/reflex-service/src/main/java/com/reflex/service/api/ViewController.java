package com.reflex.service.api;

import com.reflex.service.config.ReflexProperties;
import com.reflex.views.MaterializedViewManager;
import com.reflex.views.ViewSnapshot;
import java.util.Set;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read access to the materialized views, plus the rebuild trigger for stale ones.
 *
 * <p>Readers always get the last consistent snapshot; a stale view is returned with
 * {@code status=STALE} and its reason rather than as an error.
 */
@RestController
@RequestMapping("/api/v1/views")
public class ViewController {

    private final MaterializedViewManager views;
    private final ReflexProperties properties;

    public ViewController(MaterializedViewManager views, ReflexProperties properties) {
        this.views = views;
        this.properties = properties;
    }

    @GetMapping
    public Set<String> list() {
        return views.viewNames();
    }

    @GetMapping("/{name}")
    public ViewSnapshot get(@PathVariable String name) {
        return views.getViewState(name);
    }

    @PostMapping("/{name}/rebuild")
    public ViewSnapshot rebuild(@PathVariable String name) {
        return views.rebuild(name, properties.rebuildTimeout());
    }
}
