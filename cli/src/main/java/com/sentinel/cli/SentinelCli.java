package com.sentinel.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Главная точка входа CLI Sentinel.
 * Использует библиотеку picocli для парсинга аргументов командной строки.
 *
 * <p>Команды:
 * <ul>
 *   <li><b>run</b> - запуск скана в текущем процессе с выводом событий и итоговым отчетом</li>
 *   <li><b>watch</b> - просмотр скана, запущенного веб-приложением, через WebSocket</li>
 * </ul>
 *
 * <p>Примеры использования:
 * <pre>
 * # Локальный скан двумя агентами
 * sentinel run --target https://example.com \
 *   --worker spider=./agents/spider.sh --worker xss="python3 agents/xss.py"
 *
 * # Подписка на скан веб-приложения
 * sentinel watch --url ws://localhost:8080 3f1c...
 * </pre>
 */
@Command(
    name = "sentinel",
    description = "Оркестрация агентов сканирования безопасности",
    mixinStandardHelpOptions = true,
    version = "1.0-SNAPSHOT",
    subcommands = {RunCommand.class, WatchCommand.class}
)
public class SentinelCli implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 1;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SentinelCli()).execute(args);
        System.exit(exitCode);
    }
}
