package com.sentinel.core.worker;

import com.sentinel.core.model.WorkerIdentity;
import com.sentinel.core.model.WorkerSpec;

/**
 * Запускает процесс воркера. Точка расширения для тестов и альтернативных сред исполнения.
 */
@FunctionalInterface
public interface WorkerLauncher {

    /**
     * Запускает воркер как изолированный процесс.
     *
     * @param identity идентичность воркера внутри скана
     * @param spec роль, команда и дополнительное окружение
     * @param targetDescriptor цель сканирования
     * @return дескриптор запущенного процесса
     * @throws SpawnException если процесс не удалось запустить
     */
    WorkerProcessHandle launch(WorkerIdentity identity, WorkerSpec spec, String targetDescriptor)
        throws SpawnException;
}
