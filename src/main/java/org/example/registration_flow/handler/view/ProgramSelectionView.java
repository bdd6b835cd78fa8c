package org.example.registration_flow.handler.view;

import org.example.registration_flow.model.Program;

import java.util.List;

public record ProgramSelectionView(
        Stage stage,
        List<Program> programs,
        List<String> seasons,
        String searchTerm,
        String season,
        String error
) {

    public enum Stage {
        LOADING,
        READY,
        /** Создаём черновик регистрации на выбранную программу */
        STARTING,
        ERROR
    }
}
