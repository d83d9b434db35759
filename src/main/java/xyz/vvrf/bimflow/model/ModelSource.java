package xyz.vvrf.bimflow.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 模型来源的引用。{@code location} 的解释由 {@link xyz.vvrf.bimflow.collaborator.ModelLoader} 决定
 * (文件路径、URL 或上传缓存中的键)。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModelSource {

    private String fileName;
    private String location;

    public static ModelSource of(String fileName) {
        return new ModelSource(fileName, fileName);
    }
}
