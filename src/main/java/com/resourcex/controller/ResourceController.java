package com.resourcex.controller;

import com.resourcex.exception.CollectionNotFoundException;
import com.resourcex.model.SeriesTable;
import com.resourcex.model.SpatialMap;
import com.resourcex.model.TimeSeries;
import com.resourcex.model.param.CoordinatesParam;
import com.resourcex.model.param.ExportBundleParam;
import com.resourcex.model.param.OpenCollectionParam;
import com.resourcex.model.result.ApiResponse;
import com.resourcex.model.result.CollectionResult;
import com.resourcex.model.result.ExportResult;
import com.resourcex.model.result.SiteResult;
import com.resourcex.service.ResourceService;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * HTTP REST API over open resource collections
 */
@RestController
@RequestMapping("/api/v1/collections")
@Slf4j
public class ResourceController {

    @Autowired
    private ResourceService resourceService;

    /**
     * Open a collection from a file, directory or file pattern
     * HTTP: POST /api/v1/collections
     */
    @PostMapping
    public ResponseEntity<ApiResponse<CollectionResult>> open(@Valid @RequestBody OpenCollectionParam param) {
        log.info("Opening collection '{}' ({}, {}) from {}", param.getName(), param.getDomain(),
                param.getLayout(), param.getResourcePath());
        return ResponseEntity.ok(ApiResponse.success(resourceService.open(param)));
    }

    /**
     * HTTP: GET /api/v1/collections
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<CollectionResult>>> list() {
        return ResponseEntity.ok(ApiResponse.success(resourceService.list()));
    }

    /**
     * HTTP: GET /api/v1/collections/{name}
     */
    @GetMapping("/{name}")
    public ResponseEntity<ApiResponse<CollectionResult>> describe(@PathVariable String name) {
        return ResponseEntity.ok(ApiResponse.success(resourceService.describe(name)));
    }

    /**
     * HTTP: DELETE /api/v1/collections/{name}
     */
    @DeleteMapping("/{name}")
    public ResponseEntity<ApiResponse<String>> close(@PathVariable String name) {
        if (!resourceService.close(name)) {
            throw new CollectionNotFoundException(name);
        }
        return ResponseEntity.ok(ApiResponse.success("closed " + name));
    }

    /**
     * HTTP: GET /api/v1/collections/{name}/sites/nearest?lat=..&lon=..
     */
    @GetMapping("/{name}/sites/nearest")
    public ResponseEntity<ApiResponse<SiteResult>> nearestSite(
            @PathVariable String name,
            @RequestParam double lat,
            @RequestParam double lon) {
        return ResponseEntity.ok(ApiResponse.success(SiteResult.of(resourceService.nearestSite(name, lat, lon))));
    }

    /**
     * HTTP: POST /api/v1/collections/{name}/sites/nearest
     */
    @PostMapping("/{name}/sites/nearest")
    public ResponseEntity<ApiResponse<List<SiteResult>>> nearestSites(
            @PathVariable String name,
            @Valid @RequestBody CoordinatesParam param) {
        List<SiteResult> sites = resourceService.nearestSites(name, param.toArray()).stream()
                .map(SiteResult::of)
                .collect(Collectors.toList());
        return ResponseEntity.ok(ApiResponse.success(sites));
    }

    /**
     * Distinct values of a region column
     * HTTP: GET /api/v1/collections/{name}/regions?column=state
     */
    @GetMapping("/{name}/regions")
    public ResponseEntity<ApiResponse<List<String>>> regions(
            @PathVariable String name,
            @RequestParam(required = false) String column) {
        return ResponseEntity.ok(ApiResponse.success(resourceService.regions(name, column)));
    }

    /**
     * HTTP: GET /api/v1/collections/{name}/regions/{region}/sites?column=state
     */
    @GetMapping("/{name}/regions/{region}/sites")
    public ResponseEntity<ApiResponse<int[]>> regionSites(
            @PathVariable String name,
            @PathVariable String region,
            @RequestParam(required = false) String column) {
        return ResponseEntity.ok(ApiResponse.success(resourceService.regionSites(name, region, column)));
    }

    /**
     * HTTP: GET /api/v1/collections/{name}/datasets/{dataset}/series?gid=..
     */
    @GetMapping("/{name}/datasets/{dataset}/series")
    public ResponseEntity<ApiResponse<TimeSeries>> series(
            @PathVariable String name,
            @PathVariable String dataset,
            @RequestParam int gid) {
        return ResponseEntity.ok(ApiResponse.success(resourceService.series(name, dataset, gid)));
    }

    /**
     * Series of the site nearest to a coordinate
     * HTTP: GET /api/v1/collections/{name}/datasets/{dataset}/series/nearest?lat=..&lon=..
     */
    @GetMapping("/{name}/datasets/{dataset}/series/nearest")
    public ResponseEntity<ApiResponse<TimeSeries>> seriesAt(
            @PathVariable String name,
            @PathVariable String dataset,
            @RequestParam double lat,
            @RequestParam double lon) {
        return ResponseEntity.ok(ApiResponse.success(resourceService.seriesAt(name, dataset, lat, lon)));
    }

    /**
     * HTTP: GET /api/v1/collections/{name}/datasets/{dataset}/regions/{region}/series?column=state
     */
    @GetMapping("/{name}/datasets/{dataset}/regions/{region}/series")
    public ResponseEntity<ApiResponse<SeriesTable>> regionSeries(
            @PathVariable String name,
            @PathVariable String dataset,
            @PathVariable String region,
            @RequestParam(required = false) String column) {
        return ResponseEntity.ok(ApiResponse.success(
                resourceService.regionSeries(name, dataset, region, column)));
    }

    /**
     * HTTP: GET /api/v1/collections/{name}/datasets/{dataset}/snapshot?timestep=..[&region=..&column=..]
     */
    @GetMapping("/{name}/datasets/{dataset}/snapshot")
    public ResponseEntity<ApiResponse<SpatialMap>> snapshot(
            @PathVariable String name,
            @PathVariable String dataset,
            @RequestParam String timestep,
            @RequestParam(required = false) String region,
            @RequestParam(required = false) String column) {
        return ResponseEntity.ok(ApiResponse.success(
                resourceService.snapshot(name, dataset, timestep, region, column)));
    }

    /**
     * HTTP: GET /api/v1/collections/{name}/datasets/{dataset}/mean?years=2012,2013[&region=..&column=..]
     */
    @GetMapping("/{name}/datasets/{dataset}/mean")
    public ResponseEntity<ApiResponse<SpatialMap>> meanMap(
            @PathVariable String name,
            @PathVariable String dataset,
            @RequestParam List<Integer> years,
            @RequestParam(required = false) String region,
            @RequestParam(required = false) String column) {
        return ResponseEntity.ok(ApiResponse.success(
                resourceService.meanMap(name, dataset, years, region, column)));
    }

    /**
     * Write SAM bundle files for the given sites
     * HTTP: POST /api/v1/collections/{name}/bundles
     */
    @PostMapping("/{name}/bundles")
    public ResponseEntity<ApiResponse<ExportResult>> exportBundles(
            @PathVariable String name,
            @Valid @RequestBody ExportBundleParam param) {
        List<String> files = resourceService.exportBundles(name, param).stream()
                .map(Path::toString)
                .collect(Collectors.toList());
        log.info("Exported {} bundle(s) from '{}'", files.size(), name);
        return ResponseEntity.ok(ApiResponse.success(new ExportResult(files)));
    }
}
