package guraa.stampdetect.controller;

import guraa.stampdetect.model.DetectionResult;
import guraa.stampdetect.model.StampReference;
import guraa.stampdetect.service.StampDetectionService;
import guraa.stampdetect.service.StampStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/api/stamps")
@RequiredArgsConstructor
public class StampDetectionController {

    private final StampDetectionService detectionService;

    /**
     * Detect a reference stamp in an uploaded PDF, DOCX or image.
     *
     * @param file The uploaded document
     * @return The detection result; 422 when the document could not be processed
     */
    @PostMapping("/detect")
    public ResponseEntity<?> detect(@RequestParam("file") MultipartFile file) throws IOException {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "File is empty"));
        }

        log.debug("Detecting stamp in {} ({} bytes, {})", file.getOriginalFilename(), file.getSize(), file.getContentType());
        DetectionResult result = detectionService.detectStampOnBuffer(file.getBytes(), file.getContentType());

        if (!result.isSuccess()) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(result);
        }
        return ResponseEntity.ok(result);
    }

    /**
     * Reload the reference stamps from the configured directory.
     */
    @PostMapping("/reload")
    public ResponseEntity<Map<String, Object>> reload() {
        StampStore store = detectionService.reloadStamps();

        Map<String, Object> response = new HashMap<>();
        response.put("count", store.size());
        response.put("stamps", store.getStamps().stream().map(StampReference::getName).collect(Collectors.toList()));
        return ResponseEntity.ok(response);
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> listStamps() {
        StampStore store = detectionService.currentStore();

        List<Map<String, Object>> stamps = new ArrayList<>();
        for (StampReference stamp : store.getStamps()) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("name", stamp.getName());
            info.put("variants", stamp.getVariants().size());
            info.put("width", stamp.getBaseImage().getWidth());
            info.put("height", stamp.getBaseImage().getHeight());
            stamps.add(info);
        }

        Map<String, Object> response = new HashMap<>();
        response.put("directory", String.valueOf(store.getDirectory()));
        response.put("loadedAt", store.getLoadedAt().toString());
        response.put("stamps", stamps);
        return ResponseEntity.ok(response);
    }
}
