package com.github.jhonatas48.schemaguard.core.datasource;

/**
 * Descobre de forma consistente onde está o arquivo do banco usado pela aplicação.
 */
public interface DataSourceConnectionInfoProvider {

    /**
     * @return URL JDBC (quando conhecida) e caminho do arquivo do banco
     * @throws IllegalStateException quando o arquivo não puder ser determinado
     */
    DataSourceConnectionInfo resolve();
}
