package github.sarthakdev143.scene_compiler.model.ops;

import java.util.Optional;

public enum OperationType {
    ADD_OBJECT("addObject", "add_object"),
    UPDATE_OBJECT("updateObject", "update_object"),
    DELETE_OBJECT("deleteObject", "delete_object"),
    ADD_KEYFRAME("addKeyframe", "add_keyframe"),
    SET_SCENE_DURATION("setSceneDuration", "set_scene_duration"),
    RENAME_SCENE("renameScene", "rename_scene"),
    ADD_SCENE("addScene", "add_scene"),
    DELETE_SCENE("deleteScene", "delete_scene");

    private final String apiName;
    private final String snakeCaseName;

    OperationType(String apiName, String snakeCaseName) {
        this.apiName = apiName;
        this.snakeCaseName = snakeCaseName;
    }

    public static Optional<OperationType> fromInput(Object input) {
        if (!(input instanceof String value)) {
            return Optional.empty();
        }
        String normalized = value.trim();
        for (OperationType type : values()) {
            if (type.apiName.equals(normalized) || type.snakeCaseName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public String apiName() {
        return apiName;
    }
}
